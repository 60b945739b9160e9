package org.app.api;

import org.app.api.dto.EvaluationResult;
import org.app.api.dto.InterpretationOption;
import org.app.api.dto.ValidityReport;
import org.formula.Formula;
import org.kripke.Model;
import org.kripke.World;
import org.lattice.Interpretation;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Application boundary for front ends (editor, command line, tests).
 * Keeps callers independent from the parser and evaluator packages.
 */
public interface LogicUseCases {

    /**
     * Builds a model from JSON definitions: either one document holding every section, or a
     * directory with one file per kind (lattices.json, worlds.json, models.json, ...).
     */
    Model loadModel(Path definitions, String modelName);

    Formula parse(String formulaText);

    /**
     * Propositions used by the formula that the world does not assign, in order of occurrence.
     */
    Set<String> missingAtoms(Formula formula, World world);

    EvaluationResult evaluate(String formulaText, Model model, World world, Interpretation mode);

    /** Uses {@link #currentInterpretation()}. */
    EvaluationResult evaluate(String formulaText, Model model, World world);

    ValidityReport checkValidity(String formulaText, Model model, Interpretation mode);

    /** Uses {@link #currentInterpretation()}. */
    ValidityReport checkValidity(String formulaText, Model model);

    List<InterpretationOption> availableInterpretations();

    Interpretation currentInterpretation();

    void setInterpretation(Interpretation mode);
}
