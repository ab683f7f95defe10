package FSA.Registry;

import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * Memo table from product states (pairs of source states) to output states.
 * Pairs are packed into a single long key.
 */
public class PairRegistry {
    private final Long2IntMap pair2State;

    public PairRegistry() {
        this.pair2State = new Long2IntOpenHashMap();
        this.pair2State.defaultReturnValue(Registry.MISSING_ELEMENT);
    }

    public int get(int left, int right) {
        return pair2State.get(key(left, right));
    }

    public void put(int left, int right, int stateID) {
        pair2State.put(key(left, right), stateID);
    }

    public int size() {
        return pair2State.size();
    }

    public static long key(int left, int right) {
        return ((long) left << 32) | (right & 0xFFFFFFFFL);
    }

    public static int left(long key) {
        return (int) (key >>> 32);
    }

    public static int right(long key) {
        return (int) key;
    }
}
