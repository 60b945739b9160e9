package org.lattice;

import org.error.DomainException;

import java.util.Locale;

/**
 * How a base-lattice value is projected into a complete sublattice.
 */
public enum Interpretation {

    /** Meet of the sublattice elements above the value (ceiling). */
    UP("up"),

    /** Join of the sublattice elements below the value (floor). */
    DOWN("down");

    private final String label;

    Interpretation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses "up" / "down" (case-insensitive, surrounding spaces ignored).
     */
    public static Interpretation fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new DomainException("interpretation mode must be non-empty");
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (Interpretation mode : values()) {
            if (mode.label.equals(normalized)) {
                return mode;
            }
        }
        throw new DomainException("Unknown interpretation mode '" + raw + "', expected 'up' or 'down'");
    }

    @Override
    public String toString() {
        return label;
    }
}
