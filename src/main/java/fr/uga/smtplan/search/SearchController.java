package fr.uga.smtplan.search;

import fr.uga.smtplan.PlannerOptions;
import fr.uga.smtplan.encoding.Encoder;
import fr.uga.smtplan.encoding.EncodingException;
import fr.uga.smtplan.encoding.FormulaDocument;
import fr.uga.smtplan.grounding.GroundedModel;
import fr.uga.smtplan.plan.PlanDecoder;
import fr.uga.smtplan.plan.TemporalPlan;
import fr.uga.smtplan.rpg.ReachabilityResult;
import fr.uga.smtplan.solver.SmtSolver;
import fr.uga.smtplan.solver.SolverResult;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Locale;

/**
 * Iterative deepening over the number of happenings: encode, emit, solve, and grow the
 * bound by the step size until the solver finds a model or the upper bound is exceeded.
 */
public class SearchController {

    private static final Logger LOGGER = LogManager.getLogger(SearchController.class.getName());

    private final SmtSolver solver;
    private final FormulaOutput output;
    private final Stopwatch stopwatch;

    public SearchController(SmtSolver solver, FormulaOutput output, Stopwatch stopwatch) {
        this.solver = solver;
        this.output = output;
        this.stopwatch = stopwatch;
    }

    /**
     * Searches for a plan within the bounds of the options.
     *
     * @throws EncodingException if the formula cannot be written to its destination.
     */
    public PlanVerdict search(GroundedModel model, ReachabilityResult reachability, PlannerOptions options)
        throws EncodingException {
        final Encoder encoder = new Encoder(options.isPrune(), options.isExplanatoryNames());
        int happenings = this.firstBound(reachability, options);
        if (!options.isSolve()) {
            this.emit(encoder, model, reachability, happenings, new StringWriter());
            return PlanVerdict.notSolved(happenings);
        }
        int solved = 0;
        while (options.isUnbounded() || happenings <= options.getUpperBound()) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warn("Search interrupted before {} happenings", happenings);
                return PlanVerdict.interrupted(solved);
            }
            final StringWriter formula = new StringWriter();
            final FormulaDocument document = this.emit(encoder, model, reachability, happenings, formula);
            final SolverResult result = this.solver.checkSat(formula.toString());
            LOGGER.info("Solved {}: {} ({} seconds)", happenings, result.getVerdict(),
                String.format(Locale.ROOT, "%.3f", this.stopwatch.lap()));
            solved = happenings;
            switch (result.getVerdict()) {
                case SAT:
                    final TemporalPlan plan = PlanDecoder.decode(document, result.getModel());
                    return PlanVerdict.found(happenings, plan);
                case ERROR:
                    LOGGER.warn("Solver failed at {} happenings: {}", happenings, result.getMessage());
                    break;
                case UNSAT:
                default:
                    break;
            }
            if (happenings > Integer.MAX_VALUE - options.getStepSize()) {
                break;
            }
            happenings += options.getStepSize();
        }
        return PlanVerdict.notFound(solved == 0 ? options.getUpperBound() : solved);
    }

    /**
     * Returns the first number of happenings to try.
     */
    int firstBound(ReachabilityResult reachability, PlannerOptions options) {
        if (!options.isRpgLowerBound()) {
            return options.getLowerBound();
        }
        if (!reachability.isGoalReachable()) {
            LOGGER.warn("The goal is unreachable in the relaxed planning graph, starting at {} happenings",
                options.getLowerBound());
            return options.getLowerBound();
        }
        return Math.max(1, reachability.getGoalLayer());
    }

    private FormulaDocument emit(Encoder encoder, GroundedModel model, ReachabilityResult reachability,
                                 int happenings, StringWriter buffer) throws EncodingException {
        final Writer destination;
        try {
            destination = this.output.open(happenings);
        } catch (IOException e) {
            throw new EncodingException("Cannot open the output for " + happenings + " happenings", e);
        }
        final FormulaDocument document;
        try (Writer out = destination) {
            document = encoder.encode(model, reachability, happenings, buffer);
            out.write(buffer.toString());
        } catch (IOException e) {
            throw new EncodingException("Cannot write the formula for " + happenings + " happenings", e);
        }
        LOGGER.info("Encoded {}: {} variables, {} assertions ({} seconds)", happenings,
            document.getVariableCount(), document.getAssertionCount(),
            String.format(Locale.ROOT, "%.3f", this.stopwatch.lap()));
        return document;
    }
}
