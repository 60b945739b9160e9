package org.io.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.error.DomainException;
import org.error.ReferentialIntegrityException;
import org.io.DefinitionKind;
import org.io.DefinitionSource;
import org.kripke.Model;
import org.kripke.World;
import org.lattice.ElementPair;
import org.lattice.FilteredLattice;
import org.lattice.Lattice;
import org.lattice.ManyLattice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSON implementation of DefinitionSource. Read-only.
 *
 * Expected shape: one object with an array per kind; every entry refers to others by name.
 * {
 *   "lattices":          [ { "name": "B2", "elements": ["0","1"], "relations": [["0","0"],["0","1"],["1","1"]],
 *                            "negation_map": {"0":"1","1":"0"}, "implication_map": {"('0', '1')": "1"} } ],
 *   "filtered_lattices": [ { "filtered_lattice_name": "B2F", "lattice_name": "B2", "filter": ["1"] } ],
 *   "many_lattices":     [ { "many_lattice_name": "B2M", "filtered_lattice_name": "B2F", "comp_sub_lat": ["B2"] } ],
 *   "worlds":            [ { "world_name": "world one", "short_world_name": "w1", "lattice": "B2",
 *                            "assignments": {"p": "1"} } ],
 *   "models":            [ { "model_name": "M", "many_lattice_name": "B2M", "worlds": ["world one"],
 *                            "initial_state": "world one", "accessability_relation": {"world one": []},
 *                            "props": ["p"], "actions": [] } ]
 * }
 * Implication keys are written as a quoted pair "('a', 'b')". Model relations use world long names;
 * worlds without an entry get an empty adjacency set.
 *
 * The sections can also live in one file per kind inside a directory ({@link #fromDirectory(Path)}),
 * e.g. lattices.json holding {"lattices": [...]}. A missing per-kind file reads as an empty section.
 */
public final class JsonDefinitionSource implements DefinitionSource {

    private static final Logger log = LoggerFactory.getLogger(JsonDefinitionSource.class);

    private static final Pattern PAIR_KEY =
            Pattern.compile("^\\(\\s*(['\"])(.*?)\\1\\s*,\\s*(['\"])(.*?)\\3\\s*\\)$");

    private static final byte[] EMPTY_DOCUMENT = "{}".getBytes(StandardCharsets.UTF_8);

    private final Map<DefinitionKind, InputStreamSupplier> suppliers = new EnumMap<>(DefinitionKind.class);

    // Cached after first read; kinds sharing a supplier share the parsed document
    private final Map<InputStreamSupplier, JsonNode> documents = new IdentityHashMap<>();

    // Lattices are immutable and can be shared; everything mutable is built fresh per call.
    private final Map<String, Lattice> lattices = new HashMap<>();

    /**
     * Reads every section from a single document.
     */
    public JsonDefinitionSource(InputStreamSupplier streamSupplier) {
        Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        for (DefinitionKind kind : DefinitionKind.values()) {
            suppliers.put(kind, streamSupplier);
        }
    }

    private JsonDefinitionSource(Map<DefinitionKind, InputStreamSupplier> perKind) {
        suppliers.putAll(perKind);
    }

    /**
     * Reads each section from its own file in the directory: lattices.json, filtered_lattices.json,
     * many_lattices.json, worlds.json and models.json.
     */
    public static JsonDefinitionSource fromDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        Map<DefinitionKind, InputStreamSupplier> perKind = new EnumMap<>(DefinitionKind.class);
        for (DefinitionKind kind : DefinitionKind.values()) {
            Path file = directory.resolve(fileName(kind));
            perKind.put(kind, () -> Files.exists(file)
                    ? Files.newInputStream(file)
                    : new ByteArrayInputStream(EMPTY_DOCUMENT));
        }
        return new JsonDefinitionSource(perKind);
    }

    public static String fileName(DefinitionKind kind) {
        return sectionKey(kind) + ".json";
    }

    @Override
    public List<String> names(DefinitionKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        List<String> out = new ArrayList<>();
        for (JsonNode entry : section(kind)) {
            out.add(requireText(entry, nameField(kind)));
        }
        return out;
    }

    @Override
    public Lattice lattice(String name) {
        Lattice cached = lattices.get(name);
        if (cached != null) {
            return cached;
        }

        JsonNode node = find(DefinitionKind.LATTICE, name);

        Set<String> elements = new LinkedHashSet<>(readStrings(node, "elements"));

        Set<ElementPair> relations = new LinkedHashSet<>();
        for (JsonNode rel : requireArray(node, "relations")) {
            if (!rel.isArray() || rel.size() != 2) {
                throw new DomainException("Relation " + rel + " of lattice '" + name + "' must be a pair");
            }
            relations.add(ElementPair.of(rel.get(0).asText(), rel.get(1).asText()));
        }

        Map<String, String> negation = new LinkedHashMap<>();
        JsonNode negNode = node.path("negation_map");
        Iterator<Map.Entry<String, JsonNode>> negIt = negNode.fields();
        while (negIt.hasNext()) {
            Map.Entry<String, JsonNode> e = negIt.next();
            negation.put(e.getKey(), e.getValue().asText());
        }

        Map<ElementPair, String> implication = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> impIt = node.path("implication_map").fields();
        while (impIt.hasNext()) {
            Map.Entry<String, JsonNode> e = impIt.next();
            implication.put(parsePairKey(e.getKey(), name), e.getValue().asText());
        }

        Lattice lattice = new Lattice(name, elements, relations, negation, implication);
        lattices.put(name, lattice);
        return lattice;
    }

    @Override
    public FilteredLattice filteredLattice(String name) {
        JsonNode node = find(DefinitionKind.FILTERED_LATTICE, name);
        Lattice base = lattice(requireText(node, "lattice_name"));
        Set<String> filter = new LinkedHashSet<>(readStrings(node, "filter"));
        return new FilteredLattice(name, base, filter);
    }

    @Override
    public ManyLattice manyLattice(String name) {
        JsonNode node = find(DefinitionKind.MANY_LATTICE, name);
        FilteredLattice base = filteredLattice(requireText(node, "filtered_lattice_name"));

        List<Lattice> sublattices = new ArrayList<>();
        for (String subName : readStrings(node, "comp_sub_lat")) {
            sublattices.add(lattice(subName));
        }
        return new ManyLattice(name, base, sublattices);
    }

    @Override
    public World world(String longName) {
        JsonNode node = find(DefinitionKind.WORLD, longName);
        String shortName = requireText(node, "short_world_name");
        Lattice lattice = lattice(requireText(node, "lattice"));

        Map<String, String> assignments = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.path("assignments").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            assignments.put(e.getKey(), e.getValue().asText());
        }
        return new World(longName, shortName, lattice, assignments);
    }

    @Override
    public Model model(String name) {
        JsonNode node = find(DefinitionKind.MODEL, name);
        ManyLattice manyLattice = manyLattice(requireText(node, "many_lattice_name"));

        // each world is built once so relation endpoints and the initial state share instances
        Map<String, World> byLongName = new LinkedHashMap<>();
        for (String longName : readStrings(node, "worlds")) {
            byLongName.put(longName, world(longName));
        }

        Map<String, Set<String>> relation = Model.emptyAccessibility(byLongName.values());
        Iterator<Map.Entry<String, JsonNode>> it = node.path("accessability_relation").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            World source = requireListed(byLongName, e.getKey(), name);
            Set<String> targets = relation.get(source.shortName());
            for (JsonNode target : e.getValue()) {
                targets.add(requireListed(byLongName, target.asText(), name).shortName());
            }
        }

        World initial = requireListed(byLongName, requireText(node, "initial_state"), name);

        Model model = new Model(
                name,
                manyLattice,
                byLongName.values(),
                initial,
                relation,
                new LinkedHashSet<>(readStrings(node, "props")),
                new LinkedHashSet<>(readStrings(node, "actions"))
        );
        log.info("Loaded model '{}' over '{}' with {} worlds", name, manyLattice.name(), byLongName.size());
        return model;
    }

    private JsonNode document(DefinitionKind kind) {
        InputStreamSupplier supplier = suppliers.get(kind);
        JsonNode cached = documents.get(supplier);
        if (cached != null) {
            return cached;
        }
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream in = supplier.open()) {
            JsonNode tree = mapper.readTree(in);
            if (tree == null || tree.isMissingNode()) {
                // empty file
                tree = mapper.createObjectNode();
            }
            if (!tree.isObject()) {
                throw new DomainException("Definition document must be a JSON object");
            }
            documents.put(supplier, tree);
            return tree;
        } catch (JsonProcessingException e) {
            throw new DomainException("Malformed JSON definition document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON definition document", e);
        }
    }

    private JsonNode section(DefinitionKind kind) {
        JsonNode node = document(kind).path(sectionKey(kind));
        if (node.isMissingNode() || node.isNull()) {
            // iterates as empty
            return node;
        }
        if (!node.isArray()) {
            throw new DomainException("Section '" + sectionKey(kind) + "' must be an array");
        }
        return node;
    }

    private JsonNode find(DefinitionKind kind, String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (JsonNode entry : section(kind)) {
            if (name.equals(entry.path(nameField(kind)).asText(null))) {
                return entry;
            }
        }
        throw new ReferentialIntegrityException(
                "No entry named '" + name + "' in section '" + sectionKey(kind) + "'");
    }

    private static World requireListed(Map<String, World> byLongName, String longName, String modelName) {
        World w = byLongName.get(longName);
        if (w == null) {
            throw new ReferentialIntegrityException(
                    "World '" + longName + "' is not listed in the worlds of model '" + modelName + "'");
        }
        return w;
    }

    static ElementPair parsePairKey(String raw, String latticeName) {
        Matcher m = PAIR_KEY.matcher(raw.strip());
        if (!m.matches()) {
            throw new DomainException(
                    "Implication key " + raw + " of lattice '" + latticeName + "' must look like ('a', 'b')");
        }
        return ElementPair.of(m.group(2), m.group(4));
    }

    private static List<String> readStrings(JsonNode node, String field) {
        JsonNode arr = node.path(field);
        if (arr.isMissingNode() || arr.isNull()) {
            return List.of();
        }
        if (!arr.isArray()) {
            throw new DomainException("Field '" + field + "' must be an array of strings");
        }
        List<String> out = new ArrayList<>(arr.size());
        for (JsonNode item : arr) {
            if (!item.isValueNode()) {
                throw new DomainException("Field '" + field + "' must contain only strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    private static JsonNode requireArray(JsonNode node, String field) {
        JsonNode arr = node.path(field);
        if (!arr.isArray()) {
            throw new DomainException("Missing array field '" + field + "'");
        }
        return arr;
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new DomainException("Missing/blank field '" + field + "'");
        }
        return value.asText();
    }

    private static String sectionKey(DefinitionKind kind) {
        switch (kind) {
            case LATTICE: return "lattices";
            case FILTERED_LATTICE: return "filtered_lattices";
            case MANY_LATTICE: return "many_lattices";
            case WORLD: return "worlds";
            case MODEL: return "models";
            default: throw new IllegalStateException("Unhandled kind: " + kind);
        }
    }

    private static String nameField(DefinitionKind kind) {
        switch (kind) {
            case LATTICE: return "name";
            case FILTERED_LATTICE: return "filtered_lattice_name";
            case MANY_LATTICE: return "many_lattice_name";
            case WORLD: return "world_name";
            case MODEL: return "model_name";
            default: throw new IllegalStateException("Unhandled kind: " + kind);
        }
    }

    /**
     * Lets callers provide a file stream, a classpath resource stream, or an in-memory document.
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
