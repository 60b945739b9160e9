package org.app.service;

import org.app.api.dto.EvaluationResult;
import org.app.api.dto.InterpretationOption;
import org.app.api.dto.ValidityReport;
import org.error.FormulaSyntaxException;
import org.error.ReferentialIntegrityException;
import org.error.SemanticException;
import org.formula.Formula;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.kripke.Model;
import org.kripke.World;
import org.lattice.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class LogicApplicationServiceTest {

    private LogicApplicationService service;
    private Model model;
    private World w1;
    private World w2;

    @BeforeEach
    void setUp() {
        service = new LogicApplicationService();

        Set<ElementPair> rel = new LinkedHashSet<>(List.of(
                ElementPair.of("0", "0"), ElementPair.of("0", "1"), ElementPair.of("1", "1")));
        Lattice b2 = new Lattice("B2", new LinkedHashSet<>(List.of("0", "1")), rel,
                Map.of("0", "1", "1", "0"), Map.of());
        ManyLattice ml = new ManyLattice("B2M", new FilteredLattice("B2F", b2, Set.of("1")), List.of(b2));

        w1 = new World("w1", "w1", b2, Map.of("p", "1", "q", "1"));
        w2 = new World("w2", "w2", b2, Map.of("p", "1", "q", "0"));
        // inserted out of order on purpose; reports are sorted by long name
        model = new Model("M", ml, List.of(w2, w1), w1, Model.emptyAccessibility(List.of(w1, w2)),
                Set.of("p", "q"), Set.of());
    }

    @Nested
    class Interpretations {

        @Test
        void defaultsToDown() {
            assertEquals(Interpretation.DOWN, service.currentInterpretation());
        }

        @Test
        void offersBothModes() {
            List<Interpretation> modes = service.availableInterpretations().stream()
                    .map(InterpretationOption::mode)
                    .toList();
            assertEquals(List.of(Interpretation.DOWN, Interpretation.UP), modes);
        }

        @Test
        void switchingModeIsRemembered() {
            service.setInterpretation(Interpretation.UP);
            assertEquals(Interpretation.UP, service.currentInterpretation());
            assertEquals(Interpretation.UP, service.evaluate("p", model, w1).mode());
            assertThrows(NullPointerException.class, () -> service.setInterpretation(null));
        }
    }

    @Nested
    class Evaluation {

        @Test
        void reportsValueAndDesignation() {
            EvaluationResult r = service.evaluate("p -> q", model, w2);
            assertEquals("0", r.value());
            assertFalse(r.satisfied());
            assertEquals("w2", r.worldName());

            assertTrue(service.evaluate("p & q", model, w1).satisfied());
        }

        @Test
        void missingAtomsAreListedInOrder() {
            Formula f = service.parse("r & p & s");
            assertEquals(List.of("r", "s"), List.copyOf(service.missingAtoms(f, w1)));

            SemanticException ex = assertThrows(SemanticException.class,
                    () -> service.evaluate("r & p & s", model, w1));
            assertTrue(ex.getMessage().contains("r, s"));
        }

        @Test
        void syntaxErrorsPropagate() {
            assertThrows(FormulaSyntaxException.class, () -> service.evaluate("p &", model, w1));
        }

        @Test
        void surroundingWhitespaceIsIgnored() {
            assertEquals("1", service.evaluate("  p  ", model, w1).value());
        }

        @Test
        void worldOutsideTheModelIsRejected() {
            World stranger = new World("w9", "w9", w1.lattice(), Map.of("p", "1"));
            assertThrows(ReferentialIntegrityException.class, () -> service.evaluate("p", model, stranger));
        }
    }

    @Nested
    class Validity {

        @Test
        void listsFailingWorlds() {
            ValidityReport report = service.checkValidity("p -> q", model);
            assertFalse(report.valid());
            assertEquals(List.of("w2"), report.failedWorlds());
        }

        @Test
        void validFormulaHasNoFailures() {
            ValidityReport report = service.checkValidity("p | ~p", model, Interpretation.UP);
            assertTrue(report.valid());
            assertEquals("M", report.modelName());
        }

        @Test
        void failuresAreSortedByLongName() {
            ValidityReport report = service.checkValidity("~p", model);
            assertEquals(List.of("w1", "w2"), report.failedWorlds());
        }

        @Test
        void anyWorldMissingAnAtomAbortsTheCheck() {
            w2.assignValue("r", "1");
            assertThrows(SemanticException.class, () -> service.checkValidity("r", model));
        }
    }

    @Nested
    class Loading {

        @TempDir
        Path tmp;

        @Test
        void loadsModelFromFileAndEvaluates() throws IOException {
            String json = """
                    {
                      "lattices": [ { "name": "B2", "elements": ["0", "1"],
                                      "relations": [["0","0"],["0","1"],["1","1"]],
                                      "negation_map": {"0": "1", "1": "0"} } ],
                      "filtered_lattices": [ { "filtered_lattice_name": "B2F", "lattice_name": "B2", "filter": ["1"] } ],
                      "many_lattices": [ { "many_lattice_name": "B2M", "filtered_lattice_name": "B2F", "comp_sub_lat": ["B2"] } ],
                      "worlds": [
                        { "world_name": "first", "short_world_name": "a", "lattice": "B2", "assignments": {"p": "1"} },
                        { "world_name": "second", "short_world_name": "b", "lattice": "B2", "assignments": {"p": "0"} }
                      ],
                      "models": [ { "model_name": "Loaded", "many_lattice_name": "B2M",
                                    "worlds": ["first", "second"], "initial_state": "first",
                                    "accessability_relation": {"first": ["second"]},
                                    "props": ["p"], "actions": [] } ]
                    }
                    """;
            Path file = tmp.resolve("definitions.json");
            Files.writeString(file, json, StandardCharsets.UTF_8);

            Model loaded = service.loadModel(file, "Loaded");
            World first = loaded.world("a").orElseThrow();

            assertEquals("0", service.evaluate("[]p", loaded, first).value());
            assertEquals("1", service.evaluate("[]p", loaded, loaded.world("b").orElseThrow()).value());
            assertEquals(List.of("first"), service.checkValidity("[]p", loaded).failedWorlds());
        }

        @Test
        void loadsModelFromDirectoryOfPerKindFiles() throws IOException {
            Files.writeString(tmp.resolve("lattices.json"), """
                    {"lattices": [ {"name": "B2", "elements": ["0", "1"],
                                    "relations": [["0","0"],["0","1"],["1","1"]],
                                    "negation_map": {"0": "1", "1": "0"}} ]}
                    """, StandardCharsets.UTF_8);
            Files.writeString(tmp.resolve("filtered_lattices.json"), """
                    {"filtered_lattices": [ {"filtered_lattice_name": "B2F", "lattice_name": "B2", "filter": ["1"]} ]}
                    """, StandardCharsets.UTF_8);
            Files.writeString(tmp.resolve("many_lattices.json"), """
                    {"many_lattices": [ {"many_lattice_name": "B2M", "filtered_lattice_name": "B2F",
                                         "comp_sub_lat": ["B2"]} ]}
                    """, StandardCharsets.UTF_8);
            Files.writeString(tmp.resolve("worlds.json"), """
                    {"worlds": [ {"world_name": "only", "short_world_name": "o", "lattice": "B2",
                                  "assignments": {"p": "0"}} ]}
                    """, StandardCharsets.UTF_8);
            Files.writeString(tmp.resolve("models.json"), """
                    {"models": [ {"model_name": "Dir", "many_lattice_name": "B2M", "worlds": ["only"],
                                  "initial_state": "only", "accessability_relation": {},
                                  "props": ["p"], "actions": []} ]}
                    """, StandardCharsets.UTF_8);

            Model loaded = service.loadModel(tmp, "Dir");
            assertEquals("1", service.evaluate("~p", loaded, loaded.initialState()).value());
        }
    }
}
