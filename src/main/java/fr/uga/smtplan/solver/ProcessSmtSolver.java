package fr.uga.smtplan.solver;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs an SMT-LIB 2 solver executable on a temporary file holding the formula and reads
 * the verdict from the first line of its output.
 */
public class ProcessSmtSolver implements SmtSolver {

    private static final Logger LOGGER = LogManager.getLogger(ProcessSmtSolver.class.getName());

    private final List<String> command;

    /**
     * @param command the solver command line, e.g. {@code z3 -smt2}; the formula file is
     *                appended as last argument.
     */
    public ProcessSmtSolver(String command) {
        this.command = Arrays.stream(command.trim().split("\\s+"))
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
        if (this.command.isEmpty()) {
            throw new IllegalArgumentException("Empty solver command");
        }
    }

    public List<String> getCommand() {
        return this.command;
    }

    @Override
    public SolverResult checkSat(String formula) {
        Path file = null;
        try {
            file = Files.createTempFile("smtplan", ".smt2");
            Files.writeString(file, formula, StandardCharsets.UTF_8);

            List<String> arguments = new ArrayList<>(this.command);
            arguments.add(file.toString());
            Process process = new ProcessBuilder(arguments).redirectErrorStream(true).start();
            List<String> lines;
            try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                lines = reader.lines().collect(Collectors.toList());
            }
            int exitValue = process.waitFor();
            return interpret(lines, exitValue);
        } catch (IOException e) {
            LOGGER.warn("Unable to run solver {}: {}", this.command, e.getMessage());
            return SolverResult.error(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SolverResult.error("Interrupted while waiting for " + this.command.get(0));
        } finally {
            if (file != null) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    LOGGER.warn("Unable to delete temporary formula {}: {}", file, e.getMessage());
                }
            }
        }
    }

    /**
     * Reads a verdict from the output of the solver. Only an explicit {@code sat} or
     * {@code unsat} on the first non-blank line counts; anything else is an error, whatever
     * the exit value.
     */
    static SolverResult interpret(List<String> lines, int exitValue) {
        int first = 0;
        while (first < lines.size() && lines.get(first).isBlank()) {
            first++;
        }
        if (first == lines.size()) {
            return SolverResult.error("No output, exit value " + exitValue);
        }
        String answer = lines.get(first).trim();
        if ("unsat".equals(answer)) {
            return SolverResult.unsat();
        }
        if ("sat".equals(answer)) {
            String rest = String.join("\n", lines.subList(first + 1, lines.size()));
            return SolverResult.sat(SmtModelParser.parse(rest));
        }
        return SolverResult.error(answer + " (exit value " + exitValue + ")");
    }
}
