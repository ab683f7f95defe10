package FSA;

import java.util.BitSet;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Structural cleanup: accessible, co-accessible and trimmed parts of an automaton, and its reversal.
 * Epsilon transitions count as ordinary edges for reachability.
 */
public class NFATrim {

    private NFATrim() {}

    public static <I> Automaton<I> trim(Automaton<I> automaton) {
        final BitSet states = accessibleStates(automaton);
        states.and(coAccessibleStates(automaton));
        return restrict(automaton, states);
    }

    public static <I> Automaton<I> accessible(Automaton<I> automaton) {
        return restrict(automaton, accessibleStates(automaton));
    }

    public static <I> Automaton<I> coAccessible(Automaton<I> automaton) {
        return restrict(automaton, coAccessibleStates(automaton));
    }

    public static <I> boolean isAccessible(Automaton<I> automaton) {
        return accessibleStates(automaton).cardinality() == automaton.size();
    }

    public static <I> boolean isCoAccessible(Automaton<I> automaton) {
        return coAccessibleStates(automaton).cardinality() == automaton.size();
    }

    public static <I> boolean isTrimmed(Automaton<I> automaton) {
        return isAccessible(automaton) && isCoAccessible(automaton);
    }

    /**
     * States reachable from some initial state.
     */
    public static <I> BitSet accessibleStates(Automaton<I> automaton) {
        return reachable(successors(automaton), automaton.initialStateSet());
    }

    /**
     * States from which some accepting state is reachable.
     */
    public static <I> BitSet coAccessibleStates(Automaton<I> automaton) {
        return reachable(predecessors(automaton), automaton.acceptingStateSet());
    }

    /**
     * Reverse every transition and swap the initial and accepting state sets. The result is in general
     * non-deterministic and accepts the mirror image of every word.
     */
    public static <I> Automaton<I> reverse(Automaton<I> automaton) {
        final int numSymbols = automaton.getInputAlphabet().size();
        final AutomatonBuilder<I> rNFA = new AutomatonBuilder<>(automaton.getInputAlphabet());

        // Accepting are initial states and vice versa
        for (int s = 0; s < automaton.size(); s++) {
            rNFA.addState(automaton.isInitial(s));
            rNFA.setInitial(s, automaton.isAccepting(s));
        }
        // reverse transitions
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < numSymbols; a++) {
                for (int t : automaton.getTransitions(q, a)) {
                    rNFA.addTransition(t, a, q);
                }
            }
            for (int t : automaton.getEpsilonTransitions(q)) {
                rNFA.addEpsilonTransition(t, q);
            }
        }
        return rNFA.build();
    }

    /**
     * Keep only the given states and the transitions between them. Kept states are renumbered in increasing order.
     */
    static <I> Automaton<I> restrict(Automaton<I> automaton, BitSet keep) {
        final int numSymbols = automaton.getInputAlphabet().size();
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(automaton.getInputAlphabet());
        final int[] mapping = new int[automaton.size()];

        for (int s = 0; s < automaton.size(); s++) {
            if (keep.get(s)) {
                mapping[s] = out.addState(automaton.isAccepting(s));
                out.setInitial(mapping[s], automaton.isInitial(s));
            }
        }
        for (int s = keep.nextSetBit(0); s >= 0; s = keep.nextSetBit(s + 1)) {
            for (int a = 0; a < numSymbols; a++) {
                for (int t : automaton.getTransitions(s, a)) {
                    if (keep.get(t)) {
                        out.addTransition(mapping[s], a, mapping[t]);
                    }
                }
            }
            for (int t : automaton.getEpsilonTransitions(s)) {
                if (keep.get(t)) {
                    out.addEpsilonTransition(mapping[s], mapping[t]);
                }
            }
        }
        return out.build();
    }

    // adjacency over all symbols and epsilon, duplicates allowed
    private static <I> IntArrayList[] successors(Automaton<I> automaton) {
        final IntArrayList[] adjacency = emptyAdjacency(automaton.size());
        forEachEdge(automaton, (source, target) -> adjacency[source].add(target));
        return adjacency;
    }

    // the inverted relation, computed on demand
    private static <I> IntArrayList[] predecessors(Automaton<I> automaton) {
        final IntArrayList[] adjacency = emptyAdjacency(automaton.size());
        forEachEdge(automaton, (source, target) -> adjacency[target].add(source));
        return adjacency;
    }

    private static IntArrayList[] emptyAdjacency(int size) {
        final IntArrayList[] adjacency = new IntArrayList[size];
        for (int s = 0; s < size; s++) {
            adjacency[s] = new IntArrayList();
        }
        return adjacency;
    }

    private static <I> void forEachEdge(Automaton<I> automaton, EdgeConsumer consumer) {
        final int numSymbols = automaton.getInputAlphabet().size();
        for (int s = 0; s < automaton.size(); s++) {
            for (int a = 0; a < numSymbols; a++) {
                for (int t : automaton.getTransitions(s, a)) {
                    consumer.accept(s, t);
                }
            }
            for (int t : automaton.getEpsilonTransitions(s)) {
                consumer.accept(s, t);
            }
        }
    }

    private static BitSet reachable(IntArrayList[] adjacency, BitSet seeds) {
        final BitSet visited = (BitSet) seeds.clone();
        final IntArrayList stack = new IntArrayList();
        for (int s = seeds.nextSetBit(0); s >= 0; s = seeds.nextSetBit(s + 1)) {
            stack.add(s);
        }
        while (!stack.isEmpty()) {
            final int s = stack.popInt();
            for (int i = 0; i < adjacency[s].size(); i++) {
                final int t = adjacency[s].getInt(i);
                if (!visited.get(t)) {
                    visited.set(t);
                    stack.add(t);
                }
            }
        }
        return visited;
    }

    @FunctionalInterface
    private interface EdgeConsumer {
        void accept(int source, int target);
    }
}
