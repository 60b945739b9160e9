package org.app.service;

import org.app.api.LogicUseCases;
import org.app.api.dto.EvaluationResult;
import org.app.api.dto.InterpretationOption;
import org.app.api.dto.ValidityReport;
import org.error.ReferentialIntegrityException;
import org.error.SemanticException;
import org.formula.Formula;
import org.formula.FormulaEvaluator;
import org.formula.FormulaParser;
import org.io.DefinitionSource;
import org.io.json.JsonDefinitionSource;
import org.kripke.Model;
import org.kripke.World;
import org.lattice.Interpretation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/** Default application service: parse, pre-check, evaluate and validate formulas. */
public final class LogicApplicationService implements LogicUseCases {

    private static final Logger log = LoggerFactory.getLogger(LogicApplicationService.class);

    private static final Interpretation DEFAULT_INTERPRETATION = Interpretation.DOWN;

    private final List<InterpretationOption> interpretations;

    private Interpretation interpretation;

    public LogicApplicationService() {
        this(DEFAULT_INTERPRETATION);
    }

    public LogicApplicationService(Interpretation initialInterpretation) {
        this.interpretation = Objects.requireNonNull(initialInterpretation, "initialInterpretation must not be null");
        this.interpretations = List.of(
                new InterpretationOption(Interpretation.DOWN, "Down (floor)"),
                new InterpretationOption(Interpretation.UP, "Up (ceiling)")
        );
    }

    @Override
    public Model loadModel(Path definitions, String modelName) {
        Objects.requireNonNull(definitions, "definitions must not be null");
        Objects.requireNonNull(modelName, "modelName must not be null");
        DefinitionSource source = Files.isDirectory(definitions)
                ? JsonDefinitionSource.fromDirectory(definitions)
                : new JsonDefinitionSource(() -> Files.newInputStream(definitions));
        return source.model(modelName);
    }

    @Override
    public Formula parse(String formulaText) {
        Objects.requireNonNull(formulaText, "formulaText must not be null");
        return new FormulaParser(formulaText.strip()).parse();
    }

    @Override
    public Set<String> missingAtoms(Formula formula, World world) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(world, "world must not be null");

        Set<String> missing = new LinkedHashSet<>();
        for (String atom : formula.atoms()) {
            if (!world.isAssigned(atom)) {
                missing.add(atom);
            }
        }
        return missing;
    }

    @Override
    public EvaluationResult evaluate(String formulaText, Model model, World world, Interpretation mode) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(world, "world must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        if (!model.contains(world)) {
            throw new ReferentialIntegrityException(
                    "World '" + world.shortName() + "' is not part of model '" + model.name() + "'");
        }

        Formula formula = parse(formulaText);
        requireAssigned(formula, world);

        String value = new FormulaEvaluator(model, mode).evaluate(formula, world);
        boolean satisfied = model.manyLattice().base().isDesignated(value);

        log.debug("Evaluated '{}' at '{}' ({}): {} satisfied={}", formulaText, world.longName(), mode, value, satisfied);
        return new EvaluationResult(formulaText, world.longName(), mode, value, satisfied);
    }

    @Override
    public EvaluationResult evaluate(String formulaText, Model model, World world) {
        return evaluate(formulaText, model, world, interpretation);
    }

    @Override
    public ValidityReport checkValidity(String formulaText, Model model, Interpretation mode) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        Formula formula = parse(formulaText);

        List<World> ordered = new ArrayList<>(model.worlds());
        ordered.sort(Comparator.comparing(World::longName));

        // every world has to define every atom before anything is evaluated
        for (World w : ordered) {
            requireAssigned(formula, w);
        }

        FormulaEvaluator evaluator = new FormulaEvaluator(model, mode);
        List<String> failed = new ArrayList<>();
        for (World w : ordered) {
            String value = evaluator.evaluate(formula, w);
            if (!model.manyLattice().base().isDesignated(value)) {
                failed.add(w.longName());
            }
        }

        ValidityReport report = new ValidityReport(formulaText, model.name(), mode, failed);
        if (report.valid()) {
            log.info("'{}' is valid in model '{}' ({})", formulaText, model.name(), mode);
        } else {
            log.info("'{}' fails in {} of {} worlds of model '{}' ({}): {}",
                    formulaText, failed.size(), ordered.size(), model.name(), mode, failed);
        }
        return report;
    }

    @Override
    public ValidityReport checkValidity(String formulaText, Model model) {
        return checkValidity(formulaText, model, interpretation);
    }

    @Override
    public List<InterpretationOption> availableInterpretations() {
        return interpretations;
    }

    @Override
    public Interpretation currentInterpretation() {
        return interpretation;
    }

    @Override
    public void setInterpretation(Interpretation mode) {
        this.interpretation = Objects.requireNonNull(mode, "mode must not be null");
    }

    private void requireAssigned(Formula formula, World world) {
        Set<String> missing = missingAtoms(formula, world);
        if (!missing.isEmpty()) {
            throw new SemanticException(
                    "World '" + world.longName() + "' is missing assignments for: " + String.join(", ", missing));
        }
    }
}
