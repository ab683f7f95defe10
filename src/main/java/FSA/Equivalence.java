package FSA;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import FSA.Model.Automaton;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.word.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Language-level decision procedures. All of them are exact and accept automata of any kind.
 */
public class Equivalence {
    private static final Logger LOG = LoggerFactory.getLogger(Equivalence.class);

    private Equivalence() {}

    /**
     * Decide language equivalence by comparing the canonical minimal complete DFAs of both operands.
     *
     * @throws FSA.Model.AlphabetMismatchException if the operands have different symbols
     */
    public static <I> boolean equivalent(Automaton<I> left, Automaton<I> right) {
        final Alphabet<I> alphabet = left.getInputAlphabet();
        AlphabetUtils.requireSameSymbols(alphabet, right.getInputAlphabet(), "equivalent");

        final Automaton<I> min1 = Minimizer.minimize(left);
        final Automaton<I> min2 = Minimizer.minimize(AlphabetUtils.reindex(right, alphabet));
        LOG.debug("Comparing minimal DFAs of {} and {} states", min1.size(), min2.size());
        return identical(min1, min2);
    }

    /**
     * Decide language equivalence by testing the symmetric difference for emptiness.
     */
    public static <I> boolean equivalentBySymmetricDifference(Automaton<I> left, Automaton<I> right) {
        return isEmpty(ProductConstruction.symmetricDifference(left, right));
    }

    /**
     * @return true iff no accepting state is reachable
     */
    public static <I> boolean isEmpty(Automaton<I> automaton) {
        return !NFATrim.accessibleStates(automaton).intersects(automaton.acceptingStateSet());
    }

    /**
     * @return true iff every word over the alphabet is accepted
     */
    public static <I> boolean isUniversal(Automaton<I> automaton) {
        return isEmpty(Completion.complement(automaton));
    }

    /**
     * @return true iff every word accepted by {@code sub} is accepted by {@code sup}
     */
    public static <I> boolean includes(Automaton<I> sup, Automaton<I> sub) {
        return isEmpty(ProductConstruction.difference(sub, sup));
    }

    /**
     * @return a shortest word accepted by exactly one operand, or {@code null} if the operands are equivalent
     */
    public static <I> Word<I> findSeparatingWord(Automaton<I> left, Automaton<I> right) {
        return shortestAcceptedWord(ProductConstruction.symmetricDifference(left, right));
    }

    /**
     * @return a shortest accepted word (first in alphabet order among the shortest), or {@code null} if the language
     * is empty
     */
    public static <I> Word<I> shortestAcceptedWord(Automaton<I> automaton) {
        final Automaton<I> dfa = PowersetDeterminizer.determinize(automaton);
        final int numSymbols = dfa.getInputAlphabet().size();
        final int[] parent = new int[dfa.size()];
        final int[] parentSymbol = new int[dfa.size()];
        final BitSet visited = new BitSet();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        final int init = dfa.getInitialState();
        visited.set(init);
        parent[init] = -1;
        queue.enqueue(init);

        while (!queue.isEmpty()) {
            final int s = queue.dequeueInt();
            if (dfa.isAccepting(s)) {
                return pathTo(dfa, s, parent, parentSymbol);
            }
            for (int a = 0; a < numSymbols; a++) {
                final int t = dfa.getSuccessor(s, a);
                if (t != Automaton.MISSING_STATE && !visited.get(t)) {
                    visited.set(t);
                    parent[t] = s;
                    parentSymbol[t] = a;
                    queue.enqueue(t);
                }
            }
        }
        return null;
    }

    private static <I> Word<I> pathTo(Automaton<I> dfa, int state, int[] parent, int[] parentSymbol) {
        final List<I> symbols = new ArrayList<>();
        for (int s = state; parent[s] >= 0; s = parent[s]) {
            symbols.add(dfa.getInputAlphabet().getSymbol(parentSymbol[s]));
        }
        Collections.reverse(symbols);
        return Word.fromList(symbols);
    }

    /**
     * Structural identity of two complete DFAs over the same alphabet (same ids, acceptance and transitions).
     * For canonical minimal DFAs this is exactly language equivalence.
     */
    static <I> boolean identical(Automaton<I> dfa1, Automaton<I> dfa2) {
        if (dfa1.size() != dfa2.size() || dfa1.getInitialState() != dfa2.getInitialState()) {
            return false;
        }
        final int numSymbols = dfa1.getInputAlphabet().size();
        for (int s = 0; s < dfa1.size(); s++) {
            if (dfa1.isAccepting(s) != dfa2.isAccepting(s)) {
                return false;
            }
            for (int a = 0; a < numSymbols; a++) {
                if (dfa1.getSuccessor(s, a) != dfa2.getSuccessor(s, a)) {
                    return false;
                }
            }
        }
        return true;
    }
}
