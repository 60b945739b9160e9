package org.lattice;

import java.util.Objects;

/**
 * Ordered pair of element ids.
 * Used both as an order relation entry (first <= second) and as an implication table key.
 */
public record ElementPair(String first, String second) {

    public ElementPair {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
    }

    public static ElementPair of(String first, String second) {
        return new ElementPair(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
