package org.lattice;

import org.error.DomainException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A lattice together with a filter: the designated ("true") elements.
 */
public final class FilteredLattice {

    private final String name;
    private final Lattice lattice;
    private final Set<String> filter;

    public FilteredLattice(String name, Lattice lattice, Set<String> filter) {
        if (name == null || name.isBlank()) {
            throw new DomainException("filtered lattice name must be non-empty");
        }
        this.name = name;
        this.lattice = Objects.requireNonNull(lattice, "lattice must not be null");
        Objects.requireNonNull(filter, "filter must not be null");

        Set<String> outside = new LinkedHashSet<>(filter);
        outside.removeAll(lattice.elements());
        if (!outside.isEmpty()) {
            throw new DomainException(
                    "The filter of '" + name + "' must be a subset of the elements of lattice '"
                            + lattice.name() + "', but contains " + outside);
        }
        this.filter = Collections.unmodifiableSet(new LinkedHashSet<>(filter));
    }

    public String name() {
        return name;
    }

    public Lattice lattice() {
        return lattice;
    }

    public Set<String> filter() {
        return filter;
    }

    public boolean isDesignated(String element) {
        return filter.contains(element);
    }

    @Override
    public String toString() {
        return name;
    }
}
