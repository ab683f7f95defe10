package FSA.Registry;

import java.util.BitSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class SubsetRegistry implements Registry {
    private final Object2IntMap<BitSet> subset2State;

    public SubsetRegistry() {
        this.subset2State = new Object2IntOpenHashMap<>();
        this.subset2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(BitSet composite) {
        return subset2State.getInt(composite);
    }

    @Override
    public void put(BitSet composite, int stateID) {
        if (subset2State.containsKey(composite)) {
            throw new IllegalStateException("Composite state already registered: " + composite);
        }
        subset2State.put(composite, stateID);
    }

    @Override
    public int size() {
        return subset2State.size();
    }

    @Override
    public String toString() {
        return "Subset";
    }
}
