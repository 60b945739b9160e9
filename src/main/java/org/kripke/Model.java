package org.kripke;

import org.error.DomainException;
import org.error.ReferentialIntegrityException;
import org.lattice.ManyLattice;
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
 * Many-valued Kripke model: a many-lattice, worlds, an accessibility relation between them,
 * a designated initial world, propositions and actions.
 *
 * Worlds are identified by short name. The accessibility relation is an adjacency map
 * short name -> short names, and always has exactly one (possibly empty) entry per world.
 * Not thread-safe; callers serialise mutations.
 */
public final class Model {

    private static final Logger log = LoggerFactory.getLogger(Model.class);

    private final String name;
    private final ManyLattice manyLattice;
    private final Map<String, World> worlds = new LinkedHashMap<>();
    private final Map<String, Set<String>> accessibility = new LinkedHashMap<>();
    private final World initialState;
    private final Set<String> props;
    private final Set<String> actions;

    /**
     * @param accessibility one entry per world short name (targets may be empty); entries for
     *                      unknown worlds, unknown targets or missing worlds are rejected
     * @throws ReferentialIntegrityException if a world's lattice is not a registered complete
     *                                       sublattice, short names repeat, the initial state is not
     *                                       one of the worlds, or the relation does not match the worlds
     */
    public Model(String name,
                 ManyLattice manyLattice,
                 Collection<World> worlds,
                 World initialState,
                 Map<String, ? extends Collection<String>> accessibility,
                 Set<String> props,
                 Set<String> actions) {

        if (name == null || name.isBlank()) {
            throw new DomainException("model name must be non-empty");
        }
        this.name = name;
        this.manyLattice = Objects.requireNonNull(manyLattice, "manyLattice must not be null");
        Objects.requireNonNull(worlds, "worlds must not be null");
        Objects.requireNonNull(initialState, "initialState must not be null");
        Objects.requireNonNull(accessibility, "accessibility must not be null");
        Objects.requireNonNull(props, "props must not be null");
        Objects.requireNonNull(actions, "actions must not be null");

        for (World w : worlds) {
            Objects.requireNonNull(w, "worlds must not contain null");
            requireRegisteredLattice(w);
            if (this.worlds.putIfAbsent(w.shortName(), w) != null) {
                throw new ReferentialIntegrityException(
                        "A world with the name '" + w.shortName() + "' already exists in model '" + name + "'");
            }
        }

        if (this.worlds.get(initialState.shortName()) != initialState) {
            throw new ReferentialIntegrityException(
                    "Initial state '" + initialState.shortName() + "' is not a world of model '" + name + "'");
        }
        this.initialState = initialState;

        for (Map.Entry<String, ? extends Collection<String>> e : accessibility.entrySet()) {
            if (!this.worlds.containsKey(e.getKey())) {
                throw new ReferentialIntegrityException(
                        "Accessibility relation mentions unknown world '" + e.getKey() + "'");
            }
            Set<String> targets = new LinkedHashSet<>();
            for (String target : e.getValue()) {
                if (!this.worlds.containsKey(target)) {
                    throw new ReferentialIntegrityException(
                            "World '" + e.getKey() + "' points to unknown world '" + target + "'");
                }
                targets.add(target);
            }
            this.accessibility.put(e.getKey(), targets);
        }

        for (String shortName : this.worlds.keySet()) {
            if (!this.accessibility.containsKey(shortName)) {
                throw new ReferentialIntegrityException(
                        "World '" + shortName + "' has no entry in the accessibility relation");
            }
        }

        this.props = new LinkedHashSet<>(props);
        this.actions = new LinkedHashSet<>(actions);

        log.debug("Model '{}' created over '{}' with {} worlds, initial state '{}'",
                name, manyLattice.name(), this.worlds.size(), initialState.shortName());
    }

    /**
     * Convenience for callers building a model without edges: one empty entry per world.
     */
    public static Map<String, Set<String>> emptyAccessibility(Collection<World> worlds) {
        Map<String, Set<String>> relation = new LinkedHashMap<>();
        for (World w : worlds) {
            relation.put(w.shortName(), new LinkedHashSet<>());
        }
        return relation;
    }

    public String name() {
        return name;
    }

    public ManyLattice manyLattice() {
        return manyLattice;
    }

    public World initialState() {
        return initialState;
    }

    /** Read-only view, in insertion order. */
    public Collection<World> worlds() {
        return Collections.unmodifiableCollection(worlds.values());
    }

    public Optional<World> world(String shortName) {
        return Optional.ofNullable(worlds.get(shortName));
    }

    public Optional<World> worldByLongName(String longName) {
        for (World w : worlds.values()) {
            if (w.longName().equals(longName)) {
                return Optional.of(w);
            }
        }
        return Optional.empty();
    }

    /** Membership is by identity of the registered instance. */
    public boolean contains(World world) {
        return world != null && worlds.get(world.shortName()) == world;
    }

    public Set<String> props() {
        return Collections.unmodifiableSet(props);
    }

    public Set<String> actions() {
        return Collections.unmodifiableSet(actions);
    }

    /**
     * Adds a world with no outgoing edges.
     *
     * @throws ReferentialIntegrityException if the short name is taken or the world's lattice is
     *                                       not a registered complete sublattice
     */
    public void addWorld(World world) {
        Objects.requireNonNull(world, "world must not be null");
        if (worlds.containsKey(world.shortName())) {
            throw new ReferentialIntegrityException(
                    "A world with the name '" + world.shortName() + "' already exists in model '" + name + "'");
        }
        requireRegisteredLattice(world);

        worlds.put(world.shortName(), world);
        accessibility.put(world.shortName(), new LinkedHashSet<>());
        log.debug("Model '{}': added world '{}'", name, world.shortName());
    }

    /**
     * Removes a world. Its incoming and outgoing edges have to be deleted first.
     *
     * @throws ReferentialIntegrityException if the world is unknown, is the initial state,
     *                                       or still takes part in the accessibility relation
     */
    public void deleteWorld(World world) {
        Objects.requireNonNull(world, "world must not be null");
        String shortName = world.shortName();
        if (!contains(world)) {
            throw new ReferentialIntegrityException("World '" + shortName + "' is not part of model '" + name + "'");
        }
        if (world == initialState) {
            throw new ReferentialIntegrityException(
                    "World '" + shortName + "' is the initial state of model '" + name + "'");
        }
        if (!accessibility.get(shortName).isEmpty()) {
            throw new ReferentialIntegrityException(
                    "World '" + shortName + "' has outgoing relations. Delete them first.");
        }
        for (Map.Entry<String, Set<String>> e : accessibility.entrySet()) {
            if (e.getValue().contains(shortName)) {
                throw new ReferentialIntegrityException(
                        "World '" + e.getKey() + "' points to '" + shortName + "'. Remove relation first.");
            }
        }

        accessibility.remove(shortName);
        worlds.remove(shortName);
        log.debug("Model '{}': deleted world '{}'", name, shortName);
    }

    /**
     * Adds the edge from -> to. Adding an existing edge has no effect.
     */
    public void addRelation(String fromShortName, String toShortName) {
        requireWorld(fromShortName);
        requireWorld(toShortName);
        if (accessibility.get(fromShortName).add(toShortName)) {
            log.debug("Model '{}': added relation {} -> {}", name, fromShortName, toShortName);
        }
    }

    /**
     * @throws ReferentialIntegrityException if either world is unknown or the edge does not exist
     */
    public void deleteRelation(String fromShortName, String toShortName) {
        requireWorld(fromShortName);
        requireWorld(toShortName);
        if (!accessibility.get(fromShortName).remove(toShortName)) {
            throw new ReferentialIntegrityException(
                    "No relation exists from " + fromShortName + " to " + toShortName + ".");
        }
        log.debug("Model '{}': deleted relation {} -> {}", name, fromShortName, toShortName);
    }

    public boolean hasRelation(String fromShortName, String toShortName) {
        Set<String> targets = accessibility.get(fromShortName);
        return targets != null && targets.contains(toShortName);
    }

    /**
     * Worlds reachable in one step, in the order the edges were added.
     */
    public Set<World> accessibleWorlds(String shortName) {
        requireWorld(shortName);
        Set<World> out = new LinkedHashSet<>();
        for (String target : accessibility.get(shortName)) {
            out.add(worlds.get(target));
        }
        return out;
    }

    public Set<World> accessibleWorlds(World world) {
        Objects.requireNonNull(world, "world must not be null");
        if (!contains(world)) {
            throw new ReferentialIntegrityException(
                    "World '" + world.shortName() + "' is not part of model '" + name + "'");
        }
        return accessibleWorlds(world.shortName());
    }

    /** Read-only snapshot of the adjacency map. */
    public Map<String, Set<String>> accessibilityRelation() {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> e : accessibility.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    /** @return true if the proposition was not known before */
    public boolean addProposition(String proposition) {
        return props.add(normalizeProposition(proposition));
    }

    /** @return true if the proposition was known */
    public boolean removeProposition(String proposition) {
        return props.remove(normalizeProposition(proposition));
    }

    private static String normalizeProposition(String proposition) {
        if (proposition == null || proposition.isBlank()) {
            throw new DomainException("proposition must be non-empty");
        }
        return proposition.strip();
    }

    private World requireWorld(String shortName) {
        World w = worlds.get(shortName);
        if (w == null) {
            throw new ReferentialIntegrityException(
                    "World '" + shortName + "' does not exist in model '" + name + "'");
        }
        return w;
    }

    private void requireRegisteredLattice(World world) {
        if (!manyLattice.isRegistered(world.lattice())) {
            throw new ReferentialIntegrityException(
                    "The lattice '" + world.lattice().name() + "' of world '" + world.shortName()
                            + "' must be a complete sublattice of '" + manyLattice.name() + "'");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
