package org.lattice;

import org.error.DomainException;
import org.error.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finite lattice over opaque string elements.
 *
 * The order is given extensionally: a pair (a, b) in the relation set means a <= b.
 * The relation is only required to produce a unique meet and join for every pair of elements;
 * reflexivity, transitivity and antisymmetry are not checked separately.
 *
 * Negation and implication tables are optional and may be partial. A missing entry is not a
 * construction error; it only fails the evaluation that needs it.
 */
public final class Lattice {

    private static final Logger log = LoggerFactory.getLogger(Lattice.class);

    private final String name;
    private final Set<String> elements;
    private final Set<ElementPair> relations;
    private final Map<String, String> negationMap;
    private final Map<ElementPair, String> implicationMap;

    // element -> elements below it / above it, both restricted to the element set, in element order
    private final Map<String, Set<String>> downSets;
    private final Map<String, Set<String>> upSets;

    private final String bottom;
    private final String top;

    public Lattice(String name, Set<String> elements, Set<ElementPair> relations) {
        this(name, elements, relations, Map.of(), Map.of());
    }

    /**
     * Builds and validates the lattice.
     *
     * Validation computes meet and join for every ordered pair of elements. Each query intersects
     * two precomputed down-sets (or up-sets) and then checks the candidates against each other,
     * so the whole check is O(n^4) in the number of elements in the worst case.
     *
     * @throws DomainException if the element set is empty
     * @throws StructuralException if some pair has no unique meet or join
     */
    public Lattice(String name,
                   Set<String> elements,
                   Set<ElementPair> relations,
                   Map<String, String> negationMap,
                   Map<ElementPair, String> implicationMap) {

        this.name = requireName(name);
        Objects.requireNonNull(elements, "elements must not be null");
        Objects.requireNonNull(relations, "relations must not be null");
        Objects.requireNonNull(negationMap, "negationMap must not be null");
        Objects.requireNonNull(implicationMap, "implicationMap must not be null");

        if (elements.isEmpty()) {
            throw new DomainException("Lattice '" + name + "' must have at least one element");
        }

        this.elements = Collections.unmodifiableSet(new LinkedHashSet<>(elements));
        this.relations = Set.copyOf(relations);
        this.negationMap = Collections.unmodifiableMap(new LinkedHashMap<>(negationMap));
        this.implicationMap = Collections.unmodifiableMap(new LinkedHashMap<>(implicationMap));

        this.downSets = new LinkedHashMap<>();
        this.upSets = new LinkedHashMap<>();
        for (String a : this.elements) {
            Set<String> below = new LinkedHashSet<>();
            Set<String> above = new LinkedHashSet<>();
            for (String x : this.elements) {
                if (isLessThanOrEqual(x, a)) below.add(x);
                if (isLessThanOrEqual(a, x)) above.add(x);
            }
            downSets.put(a, below);
            upSets.put(a, above);
        }

        checkClosure();

        this.bottom = foldMeet(this.elements);
        this.top = foldJoin(this.elements);

        log.debug("Lattice '{}' validated: {} elements, {} relations, bottom={}, top={}",
                name, this.elements.size(), this.relations.size(), bottom, top);
    }

    public String name() {
        return name;
    }

    /** Unmodifiable, in the order the elements were supplied. */
    public Set<String> elements() {
        return elements;
    }

    public Set<ElementPair> relations() {
        return relations;
    }

    public Map<String, String> negationMap() {
        return negationMap;
    }

    public Map<ElementPair, String> implicationMap() {
        return implicationMap;
    }

    public String bottom() {
        return bottom;
    }

    public String top() {
        return top;
    }

    public boolean contains(String element) {
        return elements.contains(element);
    }

    public boolean isLessThanOrEqual(String a, String b) {
        return relations.contains(new ElementPair(a, b));
    }

    public Optional<String> negation(String element) {
        return Optional.ofNullable(negationMap.get(element));
    }

    public Optional<String> implication(String antecedent, String consequent) {
        return Optional.ofNullable(implicationMap.get(new ElementPair(antecedent, consequent)));
    }

    /**
     * Greatest lower bound of a and b.
     *
     * @throws DomainException if a or b is not an element
     * @throws StructuralException if the bound is absent or not unique
     */
    public String meet(String a, String b) {
        requireElements(a, b);

        Set<String> lowerBounds = new LinkedHashSet<>(downSets.get(a));
        lowerBounds.retainAll(downSets.get(b));

        if (lowerBounds.isEmpty()) {
            throw new StructuralException(
                    "No common lower bound for '" + a + "' and '" + b + "' in lattice '" + name + "'");
        }

        for (String candidate : lowerBounds) {
            if (downSets.get(candidate).containsAll(lowerBounds)) {
                return candidate;
            }
        }
        throw new StructuralException("No unique meet for '" + a + "' and '" + b + "' in lattice '" + name + "'");
    }

    /**
     * Least upper bound of a and b.
     *
     * @throws DomainException if a or b is not an element
     * @throws StructuralException if the bound is absent or not unique
     */
    public String join(String a, String b) {
        requireElements(a, b);

        Set<String> upperBounds = new LinkedHashSet<>(upSets.get(a));
        upperBounds.retainAll(upSets.get(b));

        if (upperBounds.isEmpty()) {
            throw new StructuralException(
                    "No common upper bound for '" + a + "' and '" + b + "' in lattice '" + name + "'");
        }

        for (String candidate : upperBounds) {
            if (upSets.get(candidate).containsAll(upperBounds)) {
                return candidate;
            }
        }
        throw new StructuralException("No unique join for '" + a + "' and '" + b + "' in lattice '" + name + "'");
    }

    /**
     * Meet of a collection of elements. The meet of the empty collection is top.
     */
    public String meetSet(Collection<String> subset) {
        Objects.requireNonNull(subset, "subset must not be null");
        if (subset.isEmpty()) {
            return top;
        }
        return foldMeet(subset);
    }

    /**
     * Join of a collection of elements. The join of the empty collection is bottom.
     */
    public String joinSet(Collection<String> subset) {
        Objects.requireNonNull(subset, "subset must not be null");
        if (subset.isEmpty()) {
            return bottom;
        }
        return foldJoin(subset);
    }

    // Left fold starting from the first element, so a singleton is still checked for membership.
    private String foldMeet(Collection<String> subset) {
        String lower = subset.iterator().next();
        for (String element : subset) {
            lower = meet(lower, element);
        }
        return lower;
    }

    private String foldJoin(Collection<String> subset) {
        String greatest = subset.iterator().next();
        for (String element : subset) {
            greatest = join(greatest, element);
        }
        return greatest;
    }

    private void checkClosure() {
        try {
            for (String x : elements) {
                for (String y : elements) {
                    meet(x, y);
                    join(x, y);
                }
            }
        } catch (StructuralException e) {
            throw new StructuralException("'" + name + "' is not a valid lattice: " + e.getMessage(), e);
        }
    }

    private void requireElements(String a, String b) {
        if (!elements.contains(a) || !elements.contains(b)) {
            throw new DomainException("Elements '" + a + "' or '" + b + "' not in lattice '" + name + "'");
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new DomainException("lattice name must be non-empty");
        }
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
