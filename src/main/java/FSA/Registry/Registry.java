package FSA.Registry;

import java.util.BitSet;

/**
 * Memo table from composite states (sets of source states) to the output state that represents them.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the output state registered for a composite state.
     * @param composite set of source states
     * @return output state ID or MISSING_ELEMENT if not registered yet.
     */
    int get(BitSet composite);

    /**
     * Register a new composite state. The key must not be mutated afterwards.
     * @param composite set of source states
     * @param stateID output state ID
     */
    void put(BitSet composite, int stateID);

    /**
     * @return number of registered composite states
     */
    int size();
}
