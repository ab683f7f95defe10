package FSA.Model;

/**
 * Raised when an operation with a fail-fast contract receives an automaton that does not satisfy its precondition.
 */
public class PreconditionViolationException extends AutomatonException {

    private final String operation;

    public PreconditionViolationException(String operation, String precondition) {
        super(operation + " requires " + precondition);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
