package fr.uga.smtplan.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fr.uga.smtplan.PlannerOptions;
import fr.uga.smtplan.PlanningFixtures;
import fr.uga.smtplan.encoding.EncodingException;
import fr.uga.smtplan.encoding.FormulaEvaluator;
import fr.uga.smtplan.encoding.PlanAssignment;
import fr.uga.smtplan.grounding.GroundedModel;
import fr.uga.smtplan.grounding.Grounder;
import fr.uga.smtplan.grounding.GroundingException;
import fr.uga.smtplan.model.PlanningTask;
import fr.uga.smtplan.rpg.RPGPruner;
import fr.uga.smtplan.rpg.ReachabilityResult;
import fr.uga.smtplan.solver.SmtSolver;
import fr.uga.smtplan.solver.SolverModel;
import fr.uga.smtplan.solver.SolverResult;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

public class SearchControllerTest {

    /**
     * Answers with a scripted list of results, then with the last one forever.
     */
    private static final class ScriptedSolver implements SmtSolver {

        private final Deque<SolverResult> script;
        private final List<String> formulas = new ArrayList<>();
        private SolverResult last;

        private ScriptedSolver(SolverResult... results) {
            this.script = new ArrayDeque<>(List.of(results));
            this.last = results[results.length - 1];
        }

        @Override
        public SolverResult checkSat(String formula) {
            this.formulas.add(formula);
            if (!this.script.isEmpty()) {
                this.last = this.script.poll();
            }
            return this.last;
        }
    }

    /**
     * Satisfiable exactly when a fixed plan assignment satisfies every assertion of the
     * formula, answering with that assignment as the model.
     */
    private static final class PlanCheckingSolver implements SmtSolver {

        private final SolverModel plan;

        private PlanCheckingSolver(SolverModel plan) {
            this.plan = plan;
        }

        @Override
        public SolverResult checkSat(String formula) {
            return new FormulaEvaluator(formula).falsified(this.plan).isEmpty()
                ? SolverResult.sat(this.plan) : SolverResult.unsat();
        }
    }

    /**
     * Keeps each formula in memory and remembers the happening counts it was opened for.
     */
    private static final class RecordingOutput implements FormulaOutput {

        private final List<Integer> opened = new ArrayList<>();
        private final List<StringWriter> written = new ArrayList<>();

        @Override
        public Writer open(int happenings) {
            this.opened.add(happenings);
            StringWriter writer = new StringWriter();
            this.written.add(writer);
            return writer;
        }
    }

    private GroundedModel model;
    private ReachabilityResult reachability;
    private RecordingOutput output;

    @BeforeEach
    public void setUp() throws GroundingException {
        this.model = ground(PlanningFixtures.moveXY(true));
        this.reachability = new RPGPruner().build(this.model);
        this.output = new RecordingOutput();
    }

    private static GroundedModel ground(PlanningTask task) throws GroundingException {
        return new Grounder().ground(task.getDomain(), task.getProblem());
    }

    private PlanVerdict search(SmtSolver solver, PlannerOptions options) throws EncodingException {
        return new SearchController(solver, this.output, Stopwatch.start())
            .search(this.model, this.reachability, options);
    }

    @Test
    public void visitsLowerBoundPlusMultiplesOfTheStep() throws EncodingException {
        ScriptedSolver solver = new ScriptedSolver(SolverResult.unsat());
        PlannerOptions options = PlannerOptions.builder().lowerBound(2).upperBound(8).stepSize(3).build();

        PlanVerdict verdict = search(solver, options);

        assertEquals(PlanVerdict.Status.NOT_FOUND, verdict.getStatus());
        assertEquals(List.of(2, 5, 8), this.output.opened);
        assertEquals(3, solver.formulas.size());
        assertNull(verdict.getPlan());
    }

    @Test
    public void lastValueNotAboveTheUpperBound() throws EncodingException {
        ScriptedSolver solver = new ScriptedSolver(SolverResult.unsat());
        PlannerOptions options = PlannerOptions.builder().lowerBound(1).upperBound(6).stepSize(2).build();

        search(solver, options);

        assertEquals(List.of(1, 3, 5), this.output.opened);
    }

    @Test
    public void firstSatisfiableBoundIsFound() throws EncodingException {
        SolverModel plan = new SolverModel(Map.of("sta0_0", true, "end0_2", true),
            Map.of("t0", 0.0, "t1", 0.5, "t2", 1.0, "dur0_0", 1.0));
        ScriptedSolver solver = new ScriptedSolver(SolverResult.unsat(), SolverResult.unsat(),
            SolverResult.sat(plan));
        PlannerOptions options = PlannerOptions.builder().build();

        PlanVerdict verdict = search(solver, options);

        assertTrue(verdict.isFound());
        assertEquals(3, verdict.getHappenings());
        assertEquals(List.of(1, 2, 3), this.output.opened);
        assertEquals(1, verdict.getPlan().size());
        assertEquals("(move x y)", verdict.getPlan().getSteps().get(0).getAction().getName());
    }

    @Test
    public void solverErrorDoesNotStopTheSearch() throws EncodingException {
        ScriptedSolver solver = new ScriptedSolver(SolverResult.error("segmentation fault"),
            SolverResult.sat(SolverModel.empty()));
        PlannerOptions options = PlannerOptions.builder().upperBound(5).build();

        PlanVerdict verdict = search(solver, options);

        assertEquals(PlanVerdict.Status.FOUND, verdict.getStatus());
        assertEquals(2, verdict.getHappenings());
    }

    @Test
    public void emitOnlyNeverCallsTheSolver() throws EncodingException {
        ScriptedSolver solver = new ScriptedSolver(SolverResult.sat(SolverModel.empty()));
        PlannerOptions options = PlannerOptions.builder().lowerBound(4).upperBound(10).solve(false).build();

        PlanVerdict verdict = search(solver, options);

        assertEquals(PlanVerdict.Status.NOT_SOLVED, verdict.getStatus());
        assertEquals(4, verdict.getHappenings());
        assertEquals(List.of(4), this.output.opened);
        assertTrue(solver.formulas.isEmpty());
        assertTrue(this.output.written.get(0).toString().endsWith("(check-sat)\n(get-model)\n"));
    }

    @Test
    public void writtenFormulaIsTheSolvedFormula() throws EncodingException {
        ScriptedSolver solver = new ScriptedSolver(SolverResult.unsat());
        PlannerOptions options = PlannerOptions.builder().upperBound(2).build();

        search(solver, options);

        assertEquals(this.output.written.get(0).toString(), solver.formulas.get(0));
        assertEquals(this.output.written.get(1).toString(), solver.formulas.get(1));
    }

    @Test
    public void goalLayerOverridesTheLowerBound() throws GroundingException, EncodingException {
        this.model = ground(PlanningFixtures.moves(false, List.of("x", "y", "z"),
            List.of(List.of("x", "y"), List.of("y", "z")), List.of("x"), "z"));
        this.reachability = new RPGPruner().build(this.model);
        ScriptedSolver solver = new ScriptedSolver(SolverResult.unsat());
        PlannerOptions options = PlannerOptions.builder().lowerBound(5).upperBound(6).rpgLowerBound(true).build();

        search(solver, options);

        assertEquals(List.of(2, 3, 4, 5, 6), this.output.opened);
    }

    @Test
    public void unreachableGoalKeepsTheLowerBound() throws GroundingException, EncodingException {
        this.model = ground(PlanningFixtures.moves(false, List.of("x", "y", "w"), List.of(List.of("x", "y")),
            List.of("x"), "w"));
        this.reachability = new RPGPruner().build(this.model);
        ScriptedSolver solver = new ScriptedSolver(SolverResult.unsat());
        PlannerOptions options = PlannerOptions.builder().lowerBound(3).upperBound(4).rpgLowerBound(true)
            .prune(true).build();

        PlanVerdict verdict = search(solver, options);

        assertEquals(PlanVerdict.Status.NOT_FOUND, verdict.getStatus());
        assertEquals(List.of(3, 4), this.output.opened);
    }

    @Test
    public void unopenableOutputAbortsBeforeSolving() {
        ScriptedSolver solver = new ScriptedSolver(SolverResult.unsat());
        FormulaOutput broken = happenings -> {
            throw new IOException("permission denied");
        };
        SearchController controller = new SearchController(solver, broken, Stopwatch.start());

        assertThrows(EncodingException.class,
            () -> controller.search(this.model, this.reachability, PlannerOptions.builder().build()));
        assertTrue(solver.formulas.isEmpty());
    }

    @Test
    public void instantaneousMoveIsFoundWithOneHappening() throws GroundingException, EncodingException {
        this.model = ground(PlanningFixtures.moveXY(false));
        this.reachability = new RPGPruner().build(this.model);
        PlanCheckingSolver solver = new PlanCheckingSolver(PlanAssignment.moveXY(this.model, false, false));
        PlannerOptions options = PlannerOptions.builder().upperBound(4).rpgLowerBound(true).build();

        PlanVerdict verdict = search(solver, options);

        assertEquals(1, this.reachability.getGoalLayer());
        assertEquals(PlanVerdict.Status.FOUND, verdict.getStatus());
        assertEquals(1, verdict.getHappenings());
        assertEquals(List.of(1), this.output.opened);
        assertEquals("(move x y)", verdict.getPlan().getSteps().get(0).getAction().getName());
        assertEquals(0.0, verdict.getPlan().getSteps().get(0).getTime(), 1e-9);
    }

    @Test
    public void durativeMoveIsFoundWithTwoHappenings() throws EncodingException {
        PlanCheckingSolver solver = new PlanCheckingSolver(PlanAssignment.moveXY(this.model, true, true));
        PlannerOptions options = PlannerOptions.builder().upperBound(4).rpgLowerBound(true).prune(true)
            .explanatoryNames(true).build();

        PlanVerdict verdict = search(solver, options);

        assertEquals(1, this.reachability.getGoalLayer());
        assertEquals(PlanVerdict.Status.FOUND, verdict.getStatus());
        assertEquals(2, verdict.getHappenings());
        assertEquals(List.of(1, 2), this.output.opened);
        assertEquals(1, verdict.getPlan().size());
    }

    @Test
    public void prunedUnreachableGoalIsNeverFound() throws GroundingException, EncodingException {
        this.model = ground(PlanningFixtures.moves(false, List.of("x", "y", "w"), List.of(List.of("x", "y")),
            List.of("x"), "w"));
        this.reachability = new RPGPruner().build(this.model);
        PlanCheckingSolver solver = new PlanCheckingSolver(SolverModel.empty());
        PlannerOptions options = PlannerOptions.builder().upperBound(3).prune(true).build();

        PlanVerdict verdict = search(solver, options);

        assertEquals(PlanVerdict.Status.NOT_FOUND, verdict.getStatus());
        assertEquals(3, verdict.getHappenings());
        assertTrue(this.output.written.stream().allMatch(w -> w.toString().contains("(assert false)")));
    }

    @Test
    public void interruptedThreadStopsBeforeEncoding() throws EncodingException {
        ScriptedSolver solver = new ScriptedSolver(SolverResult.unsat());
        PlannerOptions options = PlannerOptions.builder().upperBound(5).build();
        Thread.currentThread().interrupt();
        try {
            PlanVerdict verdict = search(solver, options);

            assertEquals(PlanVerdict.Status.INTERRUPTED, verdict.getStatus());
            assertEquals(0, verdict.getHappenings());
            assertTrue(this.output.opened.isEmpty());
            assertFalse(verdict.isFound());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void interruptWhileSolvingStopsAfterThatBound() throws EncodingException {
        SmtSolver interrupted = formula -> {
            Thread.currentThread().interrupt();
            return SolverResult.error("interrupted");
        };
        PlannerOptions options = PlannerOptions.builder().upperBound(5).build();
        try {
            PlanVerdict verdict = search(interrupted, options);

            assertEquals(PlanVerdict.Status.INTERRUPTED, verdict.getStatus());
            assertEquals(1, verdict.getHappenings());
            assertEquals(List.of(1), this.output.opened);
        } finally {
            Thread.interrupted();
        }
    }
}
