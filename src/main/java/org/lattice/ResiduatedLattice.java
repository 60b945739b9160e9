package org.lattice;

import org.error.DomainException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A lattice with a monoid operation and its neutral element.
 *
 * The operation table may be partial, like the negation and implication tables of the
 * underlying lattice. Keys and values of the table and the neutral element must be elements.
 */
public final class ResiduatedLattice {

    private final String name;
    private final Lattice lattice;
    private final Map<ElementPair, String> operation;
    private final String neutralElement;

    public ResiduatedLattice(String name, Lattice lattice, Map<ElementPair, String> operation, String neutralElement) {
        if (name == null || name.isBlank()) {
            throw new DomainException("residuated lattice name must be non-empty");
        }
        this.name = name;
        this.lattice = Objects.requireNonNull(lattice, "lattice must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        for (Map.Entry<ElementPair, String> e : operation.entrySet()) {
            ElementPair key = e.getKey();
            if (!lattice.contains(key.first()) || !lattice.contains(key.second()) || !lattice.contains(e.getValue())) {
                throw new DomainException(
                        "Operation entry " + key + " -> " + e.getValue() + " of '" + name
                                + "' uses elements outside lattice '" + lattice.name() + "'");
            }
        }
        if (neutralElement != null && !lattice.contains(neutralElement)) {
            throw new DomainException(
                    "Neutral element '" + neutralElement + "' of '" + name + "' is not in lattice '"
                            + lattice.name() + "'");
        }

        this.operation = Collections.unmodifiableMap(new LinkedHashMap<>(operation));
        this.neutralElement = neutralElement;
    }

    public String name() {
        return name;
    }

    public Lattice lattice() {
        return lattice;
    }

    public Map<ElementPair, String> operationTable() {
        return operation;
    }

    /** a * b, if the table defines it. */
    public Optional<String> operation(String a, String b) {
        return Optional.ofNullable(operation.get(ElementPair.of(a, b)));
    }

    public Optional<String> neutralElement() {
        return Optional.ofNullable(neutralElement);
    }

    @Override
    public String toString() {
        return name;
    }
}
