package FSA;

import java.util.Locale;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.StateLimit;
import FSA.Registry.PairRegistry;
import FSA.Registry.Registry;
import it.unimi.dsi.fastutil.longs.LongArrayFIFOQueue;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cartesian product of two complete DFAs, discovered on demand from the pair of initial states. Only reachable
 * pairs are allocated.
 * <p>
 * Operands of any kind are accepted: each is determinized and completed first. Both operands must have the same
 * symbols; the result uses the left operand's alphabet and is a complete DFA.
 */
public class ProductConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(ProductConstruction.class);

    /**
     * How the acceptance of a pair state derives from the acceptance of its components.
     */
    public enum Acceptance {
        INTERSECTION {
            @Override
            public boolean combine(boolean left, boolean right) {
                return left && right;
            }
        },
        UNION {
            @Override
            public boolean combine(boolean left, boolean right) {
                return left || right;
            }
        },
        DIFFERENCE {
            @Override
            public boolean combine(boolean left, boolean right) {
                return left && !right;
            }
        },
        SYMMETRIC_DIFFERENCE {
            @Override
            public boolean combine(boolean left, boolean right) {
                return left != right;
            }
        };

        public abstract boolean combine(boolean left, boolean right);
    }

    private final StateLimit limit;

    public ProductConstruction(StateLimit limit) {
        this.limit = limit;
    }

    /**
     * @return complete DFA accepting the words accepted by both operands
     */
    public static <I> Automaton<I> intersection(Automaton<I> left, Automaton<I> right) {
        return new ProductConstruction(StateLimit.UNBOUNDED).apply(left, right, Acceptance.INTERSECTION);
    }

    /**
     * @return complete DFA accepting the words accepted by {@code left} but not by {@code right}
     */
    public static <I> Automaton<I> difference(Automaton<I> left, Automaton<I> right) {
        return new ProductConstruction(StateLimit.UNBOUNDED).apply(left, right, Acceptance.DIFFERENCE);
    }

    /**
     * @return complete DFA accepting the words accepted by exactly one operand
     */
    public static <I> Automaton<I> symmetricDifference(Automaton<I> left, Automaton<I> right) {
        return new ProductConstruction(StateLimit.UNBOUNDED).apply(left, right, Acceptance.SYMMETRIC_DIFFERENCE);
    }

    /**
     * Deterministic alternative to {@link Composition#union(Automaton, Automaton)}.
     *
     * @return complete DFA accepting the words accepted by either operand
     */
    public static <I> Automaton<I> productUnion(Automaton<I> left, Automaton<I> right) {
        return new ProductConstruction(StateLimit.UNBOUNDED).apply(left, right, Acceptance.UNION);
    }

    public <I> Automaton<I> apply(Automaton<I> left, Automaton<I> right, Acceptance acceptance) {
        final Alphabet<I> alphabet = left.getInputAlphabet();
        final String operation = acceptance.name().toLowerCase(Locale.ROOT);
        AlphabetUtils.requireSameSymbols(alphabet, right.getInputAlphabet(), operation);

        final Automaton<I> dfa1 = Completion.toCompleteDFA(left);
        final Automaton<I> dfa2 = Completion.toCompleteDFA(AlphabetUtils.reindex(right, alphabet));
        final int numSymbols = alphabet.size();

        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final PairRegistry registry = new PairRegistry();
        final LongArrayFIFOQueue queue = new LongArrayFIFOQueue();

        final int init1 = dfa1.getInitialState();
        final int init2 = dfa2.getInitialState();
        final int initOut = out.addInitialState(acceptance.combine(dfa1.isAccepting(init1), dfa2.isAccepting(init2)));
        registry.put(init1, init2, initOut);
        queue.enqueue(PairRegistry.key(init1, init2));

        while (!queue.isEmpty()) {
            final long pair = queue.dequeueLong();
            final int p = PairRegistry.left(pair);
            final int q = PairRegistry.right(pair);
            final int source = registry.get(p, q);

            for (int a = 0; a < numSymbols; a++) {
                final int p2 = dfa1.getSuccessor(p, a);
                final int q2 = dfa2.getSuccessor(q, a);
                int target = registry.get(p2, q2);
                if (target == Registry.MISSING_ELEMENT) {
                    target = out.addState(acceptance.combine(dfa1.isAccepting(p2), dfa2.isAccepting(q2)));
                    limit.check(out.size(), operation);
                    registry.put(p2, q2, target);
                    queue.enqueue(PairRegistry.key(p2, q2));
                }
                out.addTransition(source, a, target);
            }
        }

        LOG.debug("{} product of {} x {} states: {} reachable pairs", acceptance, dfa1.size(), dfa2.size(),
                  registry.size());
        return out.build();
    }
}
