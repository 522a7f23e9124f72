package fr.uga.smtplan.parser;

/**
 * Thrown when a domain or problem file cannot be read, is not valid PDDL, or uses a
 * construct the planner does not support.
 */
public class ParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
