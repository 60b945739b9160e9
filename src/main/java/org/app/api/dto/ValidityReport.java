package org.app.api.dto;

import org.lattice.Interpretation;

import java.util.List;
import java.util.Objects;

/** Result of checking a formula at every world of a model. Failed worlds are listed by long name. */
public record ValidityReport(String formula, String modelName, Interpretation mode, List<String> failedWorlds) {
    public ValidityReport {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(modelName, "modelName must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(failedWorlds, "failedWorlds must not be null");
        failedWorlds = List.copyOf(failedWorlds);
    }

    public boolean valid() {
        return failedWorlds.isEmpty();
    }
}
