package org.lattice;

import org.error.DomainException;
import org.error.ReferentialIntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A filtered base lattice plus the complete sublattices that individual worlds compute in.
 *
 * The up/down interpretations are the only bridge between the base order and a sublattice:
 * every value that crosses from the base tables (or from another world) into a world's local
 * lattice goes through {@link #interpret(Lattice, String, Interpretation)}.
 */
public final class ManyLattice {

    private static final Logger log = LoggerFactory.getLogger(ManyLattice.class);

    private final String name;
    private final FilteredLattice base;
    private final List<Lattice> completeSublattices = new ArrayList<>();

    public ManyLattice(String name, FilteredLattice base, List<Lattice> completeSublattices) {
        if (name == null || name.isBlank()) {
            throw new DomainException("many-lattice name must be non-empty");
        }
        this.name = name;
        this.base = Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(completeSublattices, "completeSublattices must not be null");

        for (Lattice sub : completeSublattices) {
            addCompleteSublattice(sub);
        }
    }

    public String name() {
        return name;
    }

    public FilteredLattice base() {
        return base;
    }

    /** The base lattice whose order and tables are shared by all worlds. */
    public Lattice lattice() {
        return base.lattice();
    }

    public Set<String> filter() {
        return base.filter();
    }

    /** Read-only view, in registration order. */
    public List<Lattice> completeSublattices() {
        return Collections.unmodifiableList(completeSublattices);
    }

    public Optional<Lattice> completeSublattice(String sublatticeName) {
        for (Lattice sub : completeSublattices) {
            if (sub.name().equals(sublatticeName)) {
                return Optional.of(sub);
            }
        }
        return Optional.empty();
    }

    /** Registration is by name. */
    public boolean isRegistered(Lattice lattice) {
        return lattice != null && completeSublattice(lattice.name()).isPresent();
    }

    /**
     * Registers another complete sublattice.
     *
     * @throws ReferentialIntegrityException if a sublattice with the same name is already registered
     * @throws DomainException if the sublattice has elements outside the base lattice
     */
    public void addCompleteSublattice(Lattice lattice) {
        Objects.requireNonNull(lattice, "lattice must not be null");

        if (completeSublattice(lattice.name()).isPresent()) {
            throw new ReferentialIntegrityException(
                    "Lattice '" + lattice.name() + "' is already a complete sublattice of '" + name + "'");
        }

        Set<String> outside = new LinkedHashSet<>(lattice.elements());
        outside.removeAll(base.lattice().elements());
        if (!outside.isEmpty()) {
            throw new DomainException(
                    "Sublattice '" + lattice.name() + "' has elements outside base lattice '"
                            + base.lattice().name() + "': " + outside);
        }

        completeSublattices.add(lattice);
        log.debug("Registered complete sublattice '{}' in '{}'", lattice.name(), name);
    }

    public Optional<String> negation(String element) {
        return base.lattice().negation(element);
    }

    public Optional<String> implication(String antecedent, String consequent) {
        return base.lattice().implication(antecedent, consequent);
    }

    /**
     * Floor of a base element in the sublattice: the join of the sublattice elements below it
     * in the base order, or the sublattice bottom when there are none. Identity on members.
     */
    public String downInterpretation(Lattice sublattice, String element) {
        requireRegistered(sublattice);

        if (sublattice.contains(element)) {
            return element;
        }

        Set<String> lowerSet = new LinkedHashSet<>();
        for (String x : sublattice.elements()) {
            if (base.lattice().isLessThanOrEqual(x, element)) {
                lowerSet.add(x);
            }
        }

        if (lowerSet.isEmpty()) {
            return sublattice.bottom();
        }
        return sublattice.joinSet(lowerSet);
    }

    /**
     * Ceiling of a base element in the sublattice: the meet of the sublattice elements above it
     * in the base order, or the sublattice top when there are none. Identity on members.
     */
    public String upInterpretation(Lattice sublattice, String element) {
        requireRegistered(sublattice);

        if (sublattice.contains(element)) {
            return element;
        }

        Set<String> upperSet = new LinkedHashSet<>();
        for (String x : sublattice.elements()) {
            if (base.lattice().isLessThanOrEqual(element, x)) {
                upperSet.add(x);
            }
        }

        if (upperSet.isEmpty()) {
            return sublattice.top();
        }
        return sublattice.meetSet(upperSet);
    }

    public String interpret(Lattice sublattice, String element, Interpretation mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        return mode == Interpretation.UP
                ? upInterpretation(sublattice, element)
                : downInterpretation(sublattice, element);
    }

    private void requireRegistered(Lattice sublattice) {
        Objects.requireNonNull(sublattice, "sublattice must not be null");
        if (!isRegistered(sublattice)) {
            throw new ReferentialIntegrityException(
                    "Lattice '" + sublattice.name() + "' is not a registered complete sublattice of '" + name + "'");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
