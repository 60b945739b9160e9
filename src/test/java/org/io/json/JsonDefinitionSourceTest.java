package org.io.json;

import org.error.DomainException;
import org.error.ReferentialIntegrityException;
import org.io.DefinitionKind;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.kripke.Model;
import org.kripke.World;
import org.lattice.ElementPair;
import org.lattice.Lattice;
import org.lattice.ManyLattice;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JsonDefinitionSourceTest {

    static final String DOCUMENT = """
            {
              "lattices": [
                { "name": "L4", "elements": ["0", "a", "b", "1"],
                  "relations": [["0","0"],["a","a"],["b","b"],["1","1"],
                                ["0","a"],["0","b"],["0","1"],["a","1"],["b","1"]],
                  "negation_map": {"0": "1", "1": "0", "a": "a", "b": "b"},
                  "implication_map": {"('a', 'b')": "b", "(\\"1\\", \\"0\\")": "0"} },
                { "name": "L2", "elements": ["0", "1"],
                  "relations": [["0","0"],["0","1"],["1","1"]] }
              ],
              "filtered_lattices": [
                { "filtered_lattice_name": "F4", "lattice_name": "L4", "filter": ["1"] }
              ],
              "many_lattices": [
                { "many_lattice_name": "M4", "filtered_lattice_name": "F4", "comp_sub_lat": ["L4", "L2"] }
              ],
              "worlds": [
                { "world_name": "world one", "short_world_name": "w1", "lattice": "L4",
                  "assignments": {"p": "a", "q": "b"} },
                { "world_name": "world two", "short_world_name": "w2", "lattice": "L2",
                  "assignments": {"p": "1", "q": "0"} },
                { "world_name": "world three", "short_world_name": "w3", "lattice": "L2",
                  "assignments": {"p": "0"} }
              ],
              "models": [
                { "model_name": "Demo", "many_lattice_name": "M4",
                  "worlds": ["world one", "world two", "world three"],
                  "initial_state": "world one",
                  "accessability_relation": {"world two": ["world one"], "world one": ["world two", "world three"]},
                  "props": ["p", "q"], "actions": ["step"] },
                { "model_name": "Broken", "many_lattice_name": "M4",
                  "worlds": ["world one"], "initial_state": "world one",
                  "accessability_relation": {"world one": ["world two"]} }
              ]
            }
            """;

    private static JsonDefinitionSource source(String json) {
        return new JsonDefinitionSource(() -> new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    class Lattices {

        @Test
        void readsElementsRelationsAndTables() {
            Lattice l4 = source(DOCUMENT).lattice("L4");
            assertEquals(List.of("0", "a", "b", "1"), List.copyOf(l4.elements()));
            assertEquals("0", l4.meet("a", "b"));
            assertEquals(Optional.of("a"), l4.negation("a"));
            assertEquals(Optional.of("b"), l4.implication("a", "b"));
            assertEquals(Optional.of("0"), l4.implication("1", "0"));
        }

        @Test
        void latticesAreCachedPerSource() {
            JsonDefinitionSource src = source(DOCUMENT);
            assertSame(src.lattice("L2"), src.lattice("L2"));
        }

        @Test
        void listsNamesPerKind() {
            JsonDefinitionSource src = source(DOCUMENT);
            assertEquals(List.of("L4", "L2"), src.names(DefinitionKind.LATTICE));
            assertEquals(List.of("Demo", "Broken"), src.names(DefinitionKind.MODEL));
        }

        @Test
        void missingSectionHasNoNames() {
            assertEquals(List.of(), source("{}").names(DefinitionKind.WORLD));
        }

        @Test
        void unknownNameIsReferentialError() {
            assertThrows(ReferentialIntegrityException.class, () -> source(DOCUMENT).lattice("L9"));
        }

        @Test
        void relationsMustBePairs() {
            String json = "{\"lattices\":[{\"name\":\"X\",\"elements\":[\"0\"],\"relations\":[[\"0\"]]}]}";
            assertThrows(DomainException.class, () -> source(json).lattice("X"));
        }
    }

    @Nested
    class PairKeys {

        @Test
        void acceptsSingleAndDoubleQuotes() {
            assertEquals(ElementPair.of("a", "b"), JsonDefinitionSource.parsePairKey("('a', 'b')", "L"));
            assertEquals(ElementPair.of("x y", "1"), JsonDefinitionSource.parsePairKey(" (\"x y\",'1') ", "L"));
        }

        @Test
        void rejectsOtherShapes() {
            assertThrows(DomainException.class, () -> JsonDefinitionSource.parsePairKey("a,b", "L"));
            assertThrows(DomainException.class, () -> JsonDefinitionSource.parsePairKey("('a')", "L"));
        }
    }

    @Nested
    class Models {

        @Test
        void buildsWorldsAndRelationByShortName() {
            Model m = source(DOCUMENT).model("Demo");
            World w1 = m.world("w1").orElseThrow();
            assertSame(w1, m.initialState());
            assertEquals(Set.of("w2", "w3"), m.accessibilityRelation().get("w1"));
            assertEquals(Set.of("w1"), m.accessibilityRelation().get("w2"));
            assertEquals(Set.of(), m.accessibilityRelation().get("w3"));
            assertEquals(Set.of("step"), m.actions());
            assertSame(m.manyLattice().completeSublattice("L2").orElseThrow(), m.world("w2").orElseThrow().lattice());
        }

        @Test
        void manyLatticeRegistersListedSublattices() {
            ManyLattice ml = source(DOCUMENT).manyLattice("M4");
            assertEquals("L4", ml.lattice().name());
            assertEquals(Set.of("1"), ml.filter());
            assertEquals(2, ml.completeSublattices().size());
        }

        @Test
        void relationToUnlistedWorldIsRejected() {
            assertThrows(ReferentialIntegrityException.class, () -> source(DOCUMENT).model("Broken"));
        }

        @Test
        void worldsAreBuiltFreshEachTime() {
            JsonDefinitionSource src = source(DOCUMENT);
            assertNotSame(src.world("world one"), src.world("world one"));
        }
    }

    @Nested
    class Failures {

        @Test
        void malformedJsonIsDomainError() {
            assertThrows(DomainException.class, () -> source("{ not json").names(DefinitionKind.LATTICE));
        }

        @Test
        void topLevelArrayIsDomainError() {
            assertThrows(DomainException.class, () -> source("[]").names(DefinitionKind.LATTICE));
        }

        @Test
        void ioFailureIsUnchecked() {
            JsonDefinitionSource src = new JsonDefinitionSource(() -> {
                throw new IOException("disk gone");
            });
            assertThrows(UncheckedIOException.class, () -> src.names(DefinitionKind.MODEL));
        }

        @Test
        void documentIsReadOnce() {
            AtomicInteger opens = new AtomicInteger();
            JsonDefinitionSource src = new JsonDefinitionSource(() -> {
                opens.incrementAndGet();
                return new ByteArrayInputStream(DOCUMENT.getBytes(StandardCharsets.UTF_8));
            });
            src.names(DefinitionKind.LATTICE);
            src.model("Demo");
            assertEquals(1, opens.get());
        }
    }
    @Nested
    class PerKindFiles {

        @TempDir
        Path dir;

        private void write(String file, String json) throws IOException {
            Files.writeString(dir.resolve(file), json, StandardCharsets.UTF_8);
        }

        private void writeStore() throws IOException {
            write("lattices.json", """
                    {"lattices": [ {"name": "B2", "elements": ["0", "1"],
                                    "relations": [["0","0"],["0","1"],["1","1"]],
                                    "negation_map": {"0": "1", "1": "0"}} ]}
                    """);
            write("filtered_lattices.json", """
                    {"filtered_lattices": [ {"filtered_lattice_name": "B2F", "lattice_name": "B2", "filter": ["1"]} ]}
                    """);
            write("many_lattices.json", """
                    {"many_lattices": [ {"many_lattice_name": "B2M", "filtered_lattice_name": "B2F",
                                         "comp_sub_lat": ["B2"]} ]}
                    """);
            write("worlds.json", """
                    {"worlds": [ {"world_name": "first", "short_world_name": "a", "lattice": "B2",
                                  "assignments": {"p": "1"}} ]}
                    """);
            write("models.json", """
                    {"models": [ {"model_name": "Split", "many_lattice_name": "B2M", "worlds": ["first"],
                                  "initial_state": "first", "accessability_relation": {"first": ["first"]},
                                  "props": ["p"], "actions": []} ]}
                    """);
        }

        @Test
        void loadsModelFromOneFilePerKind() throws IOException {
            writeStore();
            Model m = JsonDefinitionSource.fromDirectory(dir).model("Split");
            assertEquals("B2M", m.manyLattice().name());
            assertTrue(m.hasRelation("a", "a"));
            assertEquals(Optional.of("1"), m.initialState().assignment("p"));
        }

        @Test
        void fileNamesFollowSectionNames() {
            assertEquals("filtered_lattices.json", JsonDefinitionSource.fileName(DefinitionKind.FILTERED_LATTICE));
            assertEquals("models.json", JsonDefinitionSource.fileName(DefinitionKind.MODEL));
        }

        @Test
        void missingOrEmptyFilesReadAsEmptySections() throws IOException {
            write("worlds.json", "");
            JsonDefinitionSource src = JsonDefinitionSource.fromDirectory(dir);
            assertEquals(List.of(), src.names(DefinitionKind.LATTICE));
            assertEquals(List.of(), src.names(DefinitionKind.WORLD));
            assertThrows(ReferentialIntegrityException.class, () -> src.model("Split"));
        }
    }
}
