package org.app.api.dto;

import org.lattice.Interpretation;

import java.util.Objects;

/**
 * Outcome of evaluating one formula at one world.
 *
 * @param value element of the world's local lattice
 * @param satisfied whether the value lies in the filter of the model's many-lattice
 */
public record EvaluationResult(String formula, String worldName, Interpretation mode, String value, boolean satisfied) {
    public EvaluationResult {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(worldName, "worldName must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
