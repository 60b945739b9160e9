package org.kripke;

import org.error.DomainException;
import org.lattice.Lattice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single state of a model: its own local lattice and the truth values of propositions in it.
 *
 * Whether the lattice is a registered complete sublattice is checked by the owning {@link Model}.
 */
public final class World {

    private final String longName;
    private final String shortName;
    private final Lattice lattice;
    private final Map<String, String> assignments = new LinkedHashMap<>();

    public World(String longName, String shortName, Lattice lattice) {
        this(longName, shortName, lattice, Map.of());
    }

    public World(String longName, String shortName, Lattice lattice, Map<String, String> assignments) {
        this.longName = requireName(longName, "longName");
        this.shortName = requireName(shortName, "shortName");
        this.lattice = Objects.requireNonNull(lattice, "lattice must not be null");
        Objects.requireNonNull(assignments, "assignments must not be null");

        for (Map.Entry<String, String> e : assignments.entrySet()) {
            assignValue(e.getKey(), e.getValue());
        }
    }

    public String longName() {
        return longName;
    }

    public String shortName() {
        return shortName;
    }

    public Lattice lattice() {
        return lattice;
    }

    /** Read-only view of proposition -> value. */
    public Map<String, String> assignments() {
        return Collections.unmodifiableMap(assignments);
    }

    public Optional<String> assignment(String proposition) {
        return Optional.ofNullable(assignments.get(proposition));
    }

    public boolean isAssigned(String proposition) {
        return assignments.containsKey(proposition);
    }

    /**
     * Sets the value of a proposition in this world.
     *
     * @throws DomainException if the value is not an element of this world's lattice
     */
    public void assignValue(String proposition, String value) {
        if (proposition == null || proposition.isBlank()) {
            throw new DomainException("proposition must be non-empty");
        }
        if (!lattice.contains(value)) {
            throw new DomainException(
                    "Value '" + value + "' is not in the lattice '" + lattice.name()
                            + "' assigned to world '" + longName + "'");
        }
        assignments.put(proposition, value);
    }

    private static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new DomainException(what + " must be non-empty");
        }
        return name;
    }

    @Override
    public String toString() {
        return shortName;
    }
}
