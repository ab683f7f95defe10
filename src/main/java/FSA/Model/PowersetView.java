package FSA.Model;

import java.util.BitSet;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Subset view of an {@link Automaton}: a state of the view is a set of automaton states, closed under epsilon
 * transitions. Stepping never mutates its argument.
 *
 * @param <I> input symbol type
 */
public final class PowersetView<I> {

    private final Automaton<I> automaton;

    PowersetView(Automaton<I> automaton) {
        this.automaton = automaton;
    }

    /**
     * @return epsilon closure of the initial states
     */
    public BitSet getInitialState() {
        return epsilonClosure(automaton.initialStateSet());
    }

    /**
     * @return epsilon closure of all successors of {@code state} on the symbol, possibly empty
     */
    public BitSet getSuccessor(BitSet state, int symbolIndex) {
        final BitSet result = new BitSet();
        for (int s = state.nextSetBit(0); s >= 0; s = state.nextSetBit(s + 1)) {
            for (int t : automaton.successorArray(s, symbolIndex)) {
                result.set(t);
            }
        }
        return epsilonClosure(result);
    }

    public boolean isAccepting(BitSet state) {
        for (int s = state.nextSetBit(0); s >= 0; s = state.nextSetBit(s + 1)) {
            if (automaton.isAccepting(s)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Closes the given set under epsilon transitions, in place.
     *
     * @return {@code states}
     */
    public BitSet epsilonClosure(BitSet states) {
        final IntArrayList stack = new IntArrayList();
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            stack.add(s);
        }
        while (!stack.isEmpty()) {
            for (int t : automaton.epsilonArray(stack.popInt())) {
                if (!states.get(t)) {
                    states.set(t);
                    stack.add(t);
                }
            }
        }
        return states;
    }
}
