package fr.uga.smtplan.search;

import java.io.FilterWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * The destination of the formula of each iteration. Closing the writer of an iteration
 * finishes that formula.
 */
@FunctionalInterface
public interface FormulaOutput {

    /**
     * Opens the destination for the formula with the given number of happenings.
     */
    Writer open(int happenings) throws IOException;

    /**
     * Standard output when the path is empty, otherwise the file, overwritten at every
     * iteration.
     */
    static FormulaOutput forPath(String path) {
        if (path == null || path.isEmpty()) {
            return happenings -> new FilterWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) {
                @Override
                public void close() throws IOException {
                    // Standard output stays open for the progress lines
                    flush();
                }
            };
        }
        return happenings -> Files.newBufferedWriter(Paths.get(path), StandardCharsets.UTF_8);
    }
}
