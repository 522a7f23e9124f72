package fr.uga.smtplan;

import fr.uga.smtplan.encoding.EncodingException;
import fr.uga.smtplan.grounding.Grounder;
import fr.uga.smtplan.grounding.GroundedModel;
import fr.uga.smtplan.grounding.GroundingException;
import fr.uga.smtplan.model.PlanningTask;
import fr.uga.smtplan.parser.ParseException;
import fr.uga.smtplan.parser.ParsedProblemAdapter;
import fr.uga.smtplan.rpg.RPGPruner;
import fr.uga.smtplan.rpg.ReachabilityResult;
import fr.uga.smtplan.search.FormulaOutput;
import fr.uga.smtplan.search.PlanVerdict;
import fr.uga.smtplan.search.SearchController;
import fr.uga.smtplan.search.Stopwatch;
import fr.uga.smtplan.solver.ProcessSmtSolver;
import fr.uga.smtplan.solver.SmtSolver;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command line entry point: parses a temporal PDDL domain and problem, grounds them, and
 * searches for a plan by encoding an increasing number of happenings into SMT.
 */
@CommandLine.Command(name = "smtplan", version = "smtplan 1.0",
    description = "Compiles a temporal planning problem into SMT and solves it by iterative deepening.",
    sortOptions = false, headerHeading = "Usage:%n", synopsisHeading = "%n",
    descriptionHeading = "%nDescription:%n%n", parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    exitCodeOnInvalidInput = 1, exitCodeOnUsageHelp = 1, exitCodeOnExecutionException = 1)
public class Planner implements Callable<Integer> {

    private static final Logger LOGGER = LogManager.getLogger(Planner.class.getName());

    @CommandLine.Parameters(index = "0", paramLabel = "<domain>", description = "The domain file.")
    private String domain;

    @CommandLine.Parameters(index = "1", paramLabel = "<problem>", description = "The problem file.")
    private String problem;

    @CommandLine.Option(names = {"-h", "--help"}, usageHelp = true, description = "Print this help and exit.")
    private boolean help;

    @CommandLine.Option(names = "-p", description = "Prune the encoding with the relaxed planning graph.")
    private boolean prune;

    @CommandLine.Option(names = "-l", paramLabel = "<n>", defaultValue = "1",
        description = "The first number of happenings to try (default: ${DEFAULT-VALUE}).")
    private int lowerBound;

    @CommandLine.Option(names = "-r",
        description = "Start at the goal layer of the relaxed planning graph instead of the lower bound.")
    private boolean rpgLowerBound;

    @CommandLine.Option(names = "-u", paramLabel = "<n>", defaultValue = "-1",
        description = "The last number of happenings to try, negative for no limit (default: ${DEFAULT-VALUE}).")
    private int upperBound;

    @CommandLine.Option(names = "-s", paramLabel = "<n>", defaultValue = "1",
        description = "The increment between two tries (default: ${DEFAULT-VALUE}).")
    private int stepSize;

    @CommandLine.Option(names = "-o", paramLabel = "<path>", defaultValue = "",
        description = "Write the formulas to this file instead of the standard output.")
    private String output;

    @CommandLine.Option(names = "-n", description = "Only write the first formula, do not solve it.")
    private boolean noSolve;

    @CommandLine.Option(names = "-e", description = "Use explanatory variable names.")
    private boolean explanatory;

    @CommandLine.Option(names = "--solver", paramLabel = "<command>", defaultValue = "z3 -smt2",
        description = "The solver command, the formula file is appended (default: ${DEFAULT-VALUE}).")
    private String solver;

    /**
     * The options of this run.
     *
     * @throws IllegalArgumentException if the lower bound or the step size is not positive.
     */
    public PlannerOptions toOptions() {
        return PlannerOptions.builder()
            .domainPath(this.domain)
            .problemPath(this.problem)
            .encodingPath(this.output)
            .lowerBound(this.lowerBound)
            .upperBound(this.upperBound)
            .stepSize(this.stepSize)
            .solve(!this.noSolve)
            .prune(this.prune)
            .rpgLowerBound(this.rpgLowerBound)
            .explanatoryNames(this.explanatory)
            .solverCommand(this.solver)
            .build();
    }

    @Override
    public Integer call() {
        final Stopwatch stopwatch = Stopwatch.start();
        try {
            final PlannerOptions options = this.toOptions();
            LOGGER.debug("{}", options);
            final PlanVerdict verdict = this.run(options, new ProcessSmtSolver(options.getSolverCommand()),
                FormulaOutput.forPath(options.getEncodingPath()), stopwatch);
            this.report(verdict, options);
            LOGGER.info("Total time: {} seconds", String.format(Locale.ROOT, "%.3f", stopwatch.total()));
            return verdict.getStatus() == PlanVerdict.Status.INTERRUPTED ? 1 : 0;
        } catch (IllegalArgumentException e) {
            LOGGER.error("Invalid option: {}", e.getMessage());
        } catch (ParseException e) {
            LOGGER.error("Parse error: {}", e.getMessage());
        } catch (GroundingException e) {
            LOGGER.error("Grounding error: {}", e.getMessage());
        } catch (EncodingException e) {
            LOGGER.error("Output error: {}", e.getMessage(), e);
        }
        return 1;
    }

    /**
     * Runs the whole pipeline with the given collaborators.
     */
    PlanVerdict run(PlannerOptions options, SmtSolver solver, FormulaOutput output, Stopwatch stopwatch)
        throws ParseException, GroundingException, EncodingException {
        final PlanningTask task = new ParsedProblemAdapter().parse(options.getDomainPath(),
            options.getProblemPath());
        LOGGER.info("Parsed: {} seconds", String.format(Locale.ROOT, "%.3f", stopwatch.lap()));

        final GroundedModel model = new Grounder().ground(task.getDomain(), task.getProblem());
        LOGGER.info("Grounded: {} seconds", String.format(Locale.ROOT, "%.3f", stopwatch.lap()));

        final ReachabilityResult reachability = new RPGPruner().build(model);
        LOGGER.info("RPG built: {} seconds", String.format(Locale.ROOT, "%.3f", stopwatch.lap()));

        return new SearchController(solver, output, stopwatch).search(model, reachability, options);
    }

    private void report(PlanVerdict verdict, PlannerOptions options) {
        switch (verdict.getStatus()) {
            case FOUND:
                LOGGER.info("{}", verdict.getPlan());
                LOGGER.info("Found plan with {} happenings", verdict.getHappenings());
                break;
            case NOT_FOUND:
                LOGGER.info("No plan found in {} happenings", options.isUnbounded()
                    ? verdict.getHappenings() : options.getUpperBound());
                break;
            case INTERRUPTED:
                LOGGER.warn("Search interrupted after {} happenings", verdict.getHappenings());
                break;
            case NOT_SOLVED:
            default:
                LOGGER.info("Encoded {} happenings without solving", verdict.getHappenings());
                break;
        }
    }

    /**
     * The main method of the planner.
     *
     * @param args the arguments of the command line.
     */
    public static void main(String[] args) {
        System.exit(new CommandLine(new Planner()).execute(args));
    }
}
