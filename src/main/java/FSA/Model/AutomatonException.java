package FSA.Model;

/**
 * Base class of all errors raised by automaton construction and transformation.
 * These are caller errors: the same call with corrected inputs succeeds.
 */
public class AutomatonException extends RuntimeException {

    public AutomatonException(String message) {
        super(message);
    }
}
