package FSA.Model;

/**
 * Raised when a subset or product construction would allocate more states than its {@link StateLimit} allows.
 */
public class StateLimitExceededException extends AutomatonException {

    private final int limit;

    public StateLimitExceededException(String operation, int limit) {
        super(operation + " exceeded the limit of " + limit + " states");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
