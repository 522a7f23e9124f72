package fr.uga.smtplan.grounding;

/**
 * Thrown when a domain or problem references a symbol, object or type that was never
 * declared, so that no ground model can be built.
 */
public class GroundingException extends Exception {

    private static final long serialVersionUID = 1L;

    public GroundingException(String message) {
        super(message);
    }
}
