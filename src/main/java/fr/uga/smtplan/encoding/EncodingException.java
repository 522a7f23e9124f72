package fr.uga.smtplan.encoding;

/**
 * Thrown when a formula cannot be written to its destination.
 */
public class EncodingException extends Exception {

    private static final long serialVersionUID = 1L;

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
