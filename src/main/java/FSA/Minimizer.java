package FSA;

import java.util.Arrays;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization by partition refinement (Moore's algorithm).
 * <p>
 * Starting from the partition {accepting, non-accepting}, every round assigns each state the signature
 * (its block, the block of its successor on each symbol); states with equal signatures form the blocks of the
 * next round. The block count never decreases, so the loop stops at the first round where it stays unchanged,
 * after at most |states| rounds.
 * <p>
 * The states of the result are numbered in breadth-first order from the initial block, visiting symbols in alphabet
 * order. Two minimal DFAs of the same language over the same alphabet are therefore identical, not just isomorphic.
 */
public class Minimizer {
    private static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);

    private Minimizer() {}

    /**
     * Any automaton is accepted: it is determinized, restricted to its accessible part and completed first.
     *
     * @return the canonical minimal complete DFA of the language of {@code automaton}
     */
    public static <I> Automaton<I> minimize(Automaton<I> automaton) {
        final Automaton<I> reachable = NFATrim.accessible(PowersetDeterminizer.determinize(automaton));
        final Automaton<I> dfa = Completion.toCompleteDFA(reachable);
        final int[] blocks = refine(dfa);
        return canonicalQuotient(dfa, blocks);
    }

    /**
     * Compute the coarsest partition of a complete DFA compatible with acceptance and transitions.
     *
     * @return block id of every state, ids in {@code [0, number of blocks)}
     */
    static <I> int[] refine(Automaton<I> dfa) {
        final int n = dfa.size();
        final int numSymbols = dfa.getInputAlphabet().size();

        int[] block = new int[n];
        int numBlocks = 0;
        // initial partition: accepting / non-accepting
        int acceptingBlock = -1;
        int rejectingBlock = -1;
        for (int s = 0; s < n; s++) {
            if (dfa.isAccepting(s)) {
                if (acceptingBlock < 0) {
                    acceptingBlock = numBlocks++;
                }
                block[s] = acceptingBlock;
            } else {
                if (rejectingBlock < 0) {
                    rejectingBlock = numBlocks++;
                }
                block[s] = rejectingBlock;
            }
        }

        int rounds = 0;
        while (true) {
            rounds++;
            final Object2IntMap<IntArrayList> signatures = new Object2IntOpenHashMap<>();
            signatures.defaultReturnValue(-1);
            final int[] next = new int[n];

            for (int s = 0; s < n; s++) {
                final IntArrayList signature = new IntArrayList(numSymbols + 1);
                signature.add(block[s]);
                for (int a = 0; a < numSymbols; a++) {
                    signature.add(block[dfa.getSuccessor(s, a)]);
                }
                int id = signatures.getInt(signature);
                if (id < 0) {
                    id = signatures.size();
                    signatures.put(signature, id);
                }
                next[s] = id;
            }

            final boolean stable = signatures.size() == numBlocks;
            block = next;
            numBlocks = signatures.size();
            if (stable) {
                break;
            }
        }

        LOG.debug("Refined {} states into {} blocks in {} rounds", n, numBlocks, rounds);
        return block;
    }

    /**
     * Build the quotient automaton of a complete, accessible DFA, numbering blocks in breadth-first order.
     */
    private static <I> Automaton<I> canonicalQuotient(Automaton<I> dfa, int[] block) {
        final int numSymbols = dfa.getInputAlphabet().size();
        int numBlocks = 0;
        for (int b : block) {
            numBlocks = Math.max(numBlocks, b + 1);
        }

        // any member represents its block
        final int[] representative = new int[numBlocks];
        for (int s = dfa.size() - 1; s >= 0; s--) {
            representative[block[s]] = s;
        }

        final int[] canonical = new int[numBlocks];
        Arrays.fill(canonical, -1);
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(dfa.getInputAlphabet());
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        final int initBlock = block[dfa.getInitialState()];
        canonical[initBlock] = out.addInitialState(dfa.isAccepting(representative[initBlock]));
        queue.enqueue(initBlock);

        while (!queue.isEmpty()) {
            final int b = queue.dequeueInt();
            final int rep = representative[b];
            for (int a = 0; a < numSymbols; a++) {
                final int target = block[dfa.getSuccessor(rep, a)];
                if (canonical[target] < 0) {
                    canonical[target] = out.addState(dfa.isAccepting(representative[target]));
                    queue.enqueue(target);
                }
                out.addTransition(canonical[b], a, canonical[target]);
            }
        }
        return out.build();
    }
}
