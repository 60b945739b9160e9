package org.formula;

import org.error.SemanticException;
import org.error.TableLookupException;
import org.kripke.Model;
import org.kripke.World;
import org.lattice.Interpretation;
import org.lattice.Lattice;
import org.lattice.ManyLattice;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates formulas in a model under one interpretation mode.
 *
 * Values are computed in the local lattice of the world being evaluated. Negation and implication
 * come from the base tables of the model's many-lattice and are projected back into the local
 * lattice; Box projects the values found at accessible worlds into the current world's lattice.
 * Evaluation is a pure recursive walk; nothing is cached.
 */
public final class FormulaEvaluator {

    private final Model model;
    private final ManyLattice manyLattice;
    private final Interpretation mode;

    public FormulaEvaluator(Model model, Interpretation mode) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.manyLattice = model.manyLattice();
    }

    public Interpretation mode() {
        return mode;
    }

    public String evaluate(Formula formula, World world) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(world, "world must not be null");

        if (formula instanceof Formula.Atom atom) {
            return world.assignment(atom.name()).orElseThrow(() -> new SemanticException(
                    "Proposition '" + atom.name() + "' is not defined in world '" + world.longName() + "'"));
        }
        if (formula instanceof Formula.Not not) {
            return negate(evaluate(not.operand(), world), world);
        }
        if (formula instanceof Formula.And and) {
            String a = evaluate(and.left(), world);
            String b = evaluate(and.right(), world);
            return world.lattice().meet(a, b);
        }
        if (formula instanceof Formula.Or or) {
            String a = evaluate(or.left(), world);
            String b = evaluate(or.right(), world);
            return world.lattice().join(a, b);
        }
        if (formula instanceof Formula.Implies implies) {
            return implies(evaluate(implies.left(), world), evaluate(implies.right(), world), world);
        }
        if (formula instanceof Formula.Iff iff) {
            Formula expanded = new Formula.And(
                    new Formula.Implies(iff.left(), iff.right()),
                    new Formula.Implies(iff.right(), iff.left()));
            return evaluate(expanded, world);
        }
        if (formula instanceof Formula.Box box) {
            return box(box.operand(), world);
        }
        if (formula instanceof Formula.Diamond diamond) {
            Formula expanded = new Formula.Not(new Formula.Box(new Formula.Not(diamond.operand())));
            return evaluate(expanded, world);
        }
        throw new IllegalStateException("Unhandled formula variant: " + formula.getClass().getName());
    }

    private String negate(String value, World world) {
        String negatedBase = manyLattice.negation(value).orElseThrow(() -> new TableLookupException(
                "Negation not defined for '" + value + "' in base lattice '" + manyLattice.lattice().name() + "'"));
        return manyLattice.interpret(world.lattice(), negatedBase, mode);
    }

    private String implies(String a, String b, World world) {
        Optional<String> tabled = manyLattice.implication(a, b);
        if (tabled.isPresent()) {
            return manyLattice.interpret(world.lattice(), tabled.get(), mode);
        }

        // material implication: ~a | b
        String negatedBase = manyLattice.negation(a).orElseThrow(() -> new TableLookupException(
                "Negation not defined for '" + a + "' (required for the implication fallback of ("
                        + a + ", " + b + ")) in base lattice '" + manyLattice.lattice().name() + "'"));
        String notA = manyLattice.interpret(world.lattice(), negatedBase, mode);
        return world.lattice().join(notA, b);
    }

    private String box(Formula operand, World world) {
        Set<World> accessible = model.accessibleWorlds(world);
        Lattice local = world.lattice();

        if (accessible.isEmpty()) {
            return local.top();
        }

        Set<String> projected = new LinkedHashSet<>();
        for (World u : accessible) {
            String raw = evaluate(operand, u);
            projected.add(manyLattice.interpret(local, raw, mode));
        }
        return local.meetSet(projected);
    }
}
