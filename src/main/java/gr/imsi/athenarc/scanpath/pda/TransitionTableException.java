package gr.imsi.athenarc.scanpath.pda;

/**
 * Raised when a transition table cannot be built, either because two rules share a key
 * or because a table file is malformed.
 */
public class TransitionTableException extends RuntimeException {

    public TransitionTableException(String message) {
        super(message);
    }

    public TransitionTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
