package FSA.Model;

/**
 * Upper bound on the number of states a construction may allocate.
 * Subset and product constructions can grow exponentially/multiplicatively, so callers handling untrusted input
 * should pass an explicit limit.
 */
public final class StateLimit {

    public static final StateLimit UNBOUNDED = new StateLimit(Integer.MAX_VALUE);

    private final int maxStates;

    private StateLimit(int maxStates) {
        this.maxStates = maxStates;
    }

    public static StateLimit of(int maxStates) {
        if (maxStates <= 0) {
            throw new IllegalArgumentException("State limit must be positive: " + maxStates);
        }
        return new StateLimit(maxStates);
    }

    public int getMaxStates() {
        return maxStates;
    }

    public boolean isAboveThreshold(int states) {
        return states > maxStates;
    }

    /**
     * @param states number of states allocated so far
     * @param operation name reported in the exception
     * @throws StateLimitExceededException if {@code states} is above the limit
     */
    public void check(int states, String operation) {
        if (isAboveThreshold(states)) {
            throw new StateLimitExceededException(operation, maxStates);
        }
    }

    @Override
    public String toString() {
        return this == UNBOUNDED ? "unbounded" : String.valueOf(maxStates);
    }
}
