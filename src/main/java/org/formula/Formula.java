package org.formula;

import org.kripke.Model;
import org.kripke.World;
import org.lattice.Interpretation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract syntax tree of a modal formula.
 *
 * The variants are closed; {@link FormulaEvaluator} and {@link #atoms()} dispatch over all of them.
 */
public sealed interface Formula {

    /**
     * Truth value of this formula at a world, as an element of that world's lattice.
     */
    default String evaluate(Model model, World world, Interpretation mode) {
        return new FormulaEvaluator(model, mode).evaluate(this, world);
    }

    /**
     * Names of all propositions occurring in the formula, in order of first occurrence.
     */
    default Set<String> atoms() {
        Set<String> out = new LinkedHashSet<>();
        collectAtoms(this, out);
        return Collections.unmodifiableSet(out);
    }

    private static void collectAtoms(Formula f, Set<String> out) {
        if (f instanceof Atom atom) {
            out.add(atom.name());
        } else if (f instanceof Not not) {
            collectAtoms(not.operand(), out);
        } else if (f instanceof Box box) {
            collectAtoms(box.operand(), out);
        } else if (f instanceof Diamond diamond) {
            collectAtoms(diamond.operand(), out);
        } else if (f instanceof And and) {
            collectAtoms(and.left(), out);
            collectAtoms(and.right(), out);
        } else if (f instanceof Or or) {
            collectAtoms(or.left(), out);
            collectAtoms(or.right(), out);
        } else if (f instanceof Implies implies) {
            collectAtoms(implies.left(), out);
            collectAtoms(implies.right(), out);
        } else if (f instanceof Iff iff) {
            collectAtoms(iff.left(), out);
            collectAtoms(iff.right(), out);
        } else {
            throw new IllegalStateException("Unhandled formula variant: " + f.getClass().getName());
        }
    }

    record Atom(String name) implements Formula {
        public Atom {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("atom name must be non-empty");
            }
        }
    }

    record Not(Formula operand) implements Formula {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    record And(Formula left, Formula right) implements Formula {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Or(Formula left, Formula right) implements Formula {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Implies(Formula left, Formula right) implements Formula {
        public Implies {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /** Defined as (left -> right) & (right -> left). */
    record Iff(Formula left, Formula right) implements Formula {
        public Iff {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Box(Formula operand) implements Formula {
        public Box {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /** Defined as ~[]~operand. */
    record Diamond(Formula operand) implements Formula {
        public Diamond {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }
}
