package org.app.api.dto;

import org.lattice.Interpretation;

import java.util.Objects;

/** UI-safe descriptor for a selectable interpretation mode. */
public record InterpretationOption(Interpretation mode, String label) {
    public InterpretationOption {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }

    @Override
    public String toString() {
        return label;
    }
}
