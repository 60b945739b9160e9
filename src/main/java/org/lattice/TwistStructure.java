package org.lattice;

import org.error.DomainException;
import org.error.TableLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The product L x L of a residuated lattice L, read as pairs (evidence for, evidence against).
 *
 * Two orders are defined on the pairs:
 * <ul>
 *   <li>truth: (t1, f1) &lt;=t (t2, f2) iff t1 &lt;= t2 and f2 &lt;= f1</li>
 *   <li>knowledge: (t1, f1) &lt;=k (t2, f2) iff t1 &lt;= t2 and f1 &lt;= f2</li>
 * </ul>
 * Both are precomputed as up-sets when the structure is built.
 */
public final class TwistStructure {

    private static final Logger log = LoggerFactory.getLogger(TwistStructure.class);

    private final ResiduatedLattice residuatedLattice;
    private final Lattice base;
    private final Set<ElementPair> elements;

    // pair -> pairs above it in the respective order
    private final Map<ElementPair, Set<ElementPair>> truthUpSets;
    private final Map<ElementPair, Set<ElementPair>> knowledgeUpSets;

    public TwistStructure(ResiduatedLattice residuatedLattice) {
        this.residuatedLattice = Objects.requireNonNull(residuatedLattice, "residuatedLattice must not be null");
        this.base = residuatedLattice.lattice();

        Set<ElementPair> pairs = new LinkedHashSet<>();
        for (String t : base.elements()) {
            for (String f : base.elements()) {
                pairs.add(ElementPair.of(t, f));
            }
        }
        this.elements = Collections.unmodifiableSet(pairs);

        this.truthUpSets = new LinkedHashMap<>();
        this.knowledgeUpSets = new LinkedHashMap<>();
        for (ElementPair p1 : elements) {
            Set<ElementPair> truthAbove = new LinkedHashSet<>();
            Set<ElementPair> knowledgeAbove = new LinkedHashSet<>();
            for (ElementPair p2 : elements) {
                if (base.isLessThanOrEqual(p1.first(), p2.first())) {
                    if (base.isLessThanOrEqual(p2.second(), p1.second())) truthAbove.add(p2);
                    if (base.isLessThanOrEqual(p1.second(), p2.second())) knowledgeAbove.add(p2);
                }
            }
            truthUpSets.put(p1, truthAbove);
            knowledgeUpSets.put(p1, knowledgeAbove);
        }

        log.debug("Twist structure over '{}' built with {} pairs", residuatedLattice.name(), elements.size());
    }

    public ResiduatedLattice residuatedLattice() {
        return residuatedLattice;
    }

    public Set<ElementPair> elements() {
        return elements;
    }

    public boolean contains(ElementPair pair) {
        return elements.contains(pair);
    }

    public boolean isLessThanOrEqualInTruth(ElementPair a, ElementPair b) {
        requireMember(a);
        requireMember(b);
        return truthUpSets.get(a).contains(b);
    }

    public boolean isLessThanOrEqualInKnowledge(ElementPair a, ElementPair b) {
        requireMember(a);
        requireMember(b);
        return knowledgeUpSets.get(a).contains(b);
    }

    /** (t, f) becomes (f, t). */
    public ElementPair negation(ElementPair pair) {
        requireMember(pair);
        return ElementPair.of(pair.second(), pair.first());
    }

    /** Meet in the truth order: (t1 ^ t2, f1 v f2). */
    public ElementPair weakMeet(ElementPair a, ElementPair b) {
        requireMember(a);
        requireMember(b);
        return ElementPair.of(base.meet(a.first(), b.first()), base.join(a.second(), b.second()));
    }

    /** Join in the truth order: (t1 v t2, f1 ^ f2). */
    public ElementPair weakJoin(ElementPair a, ElementPair b) {
        requireMember(a);
        requireMember(b);
        return ElementPair.of(base.join(a.first(), b.first()), base.meet(a.second(), b.second()));
    }

    /**
     * (t1 ^ t2, (t1 -> f2) ^ (t2 -> f1)).
     *
     * @throws TableLookupException if either implication is missing from the base table
     */
    public ElementPair consensus(ElementPair a, ElementPair b) {
        requireMember(a);
        requireMember(b);
        String truth = base.meet(a.first(), b.first());
        String left = requireImplication(a.first(), b.second(), "consensus");
        String right = requireImplication(b.first(), a.second(), "consensus");
        return ElementPair.of(truth, base.meet(left, right));
    }

    /** Join in the knowledge order: (t1 v t2, f1 v f2). */
    public ElementPair acceptAll(ElementPair a, ElementPair b) {
        requireMember(a);
        requireMember(b);
        return ElementPair.of(base.join(a.first(), b.first()), base.join(a.second(), b.second()));
    }

    /**
     * ((t1 -> t2) ^ (f2 -> f1), t1 ^ f2).
     *
     * @throws TableLookupException if either implication is missing from the base table
     */
    public ElementPair implication(ElementPair a, ElementPair b) {
        requireMember(a);
        requireMember(b);
        String forward = requireImplication(a.first(), b.first(), "implication");
        String backward = requireImplication(b.second(), a.second(), "implication");
        return ElementPair.of(base.meet(forward, backward), base.meet(a.first(), b.second()));
    }

    private String requireImplication(String antecedent, String consequent, String operation) {
        return base.implication(antecedent, consequent).orElseThrow(() -> new TableLookupException(
                "Implication (" + antecedent + ", " + consequent + ") required for the twist " + operation
                        + " is not defined in lattice '" + base.name() + "'"));
    }

    private void requireMember(ElementPair pair) {
        Objects.requireNonNull(pair, "pair must not be null");
        if (!elements.contains(pair)) {
            throw new DomainException(
                    "Pair " + pair + " is not an element of the twist structure over '"
                            + residuatedLattice.name() + "'");
        }
    }

    @Override
    public String toString() {
        return "Twist(" + residuatedLattice.name() + ")";
    }
}
