package FSA;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.PowersetView;
import FSA.Model.StateLimit;
import FSA.Registry.Registry;
import FSA.Registry.SubsetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction. Composite states are discovered on demand from the epsilon closure of the initial states,
 * so only the reachable part of the powerset is ever allocated.
 */
public class PowersetDeterminizer {
    private static final Logger LOG = LoggerFactory.getLogger(PowersetDeterminizer.class);

    private final StateLimit limit;

    public PowersetDeterminizer(StateLimit limit) {
        this.limit = limit;
    }

    /**
     * Determinize without a state limit.
     */
    public static <I> Automaton<I> determinize(Automaton<I> automaton) {
        return new PowersetDeterminizer(StateLimit.UNBOUNDED).apply(automaton);
    }

    /**
     * @param automaton any automaton, epsilon transitions allowed
     * @return an equivalent deterministic automaton, not necessarily complete. Deterministic input is returned as is.
     * @throws FSA.Model.StateLimitExceededException if more composite states than the limit are reachable
     */
    public <I> Automaton<I> apply(Automaton<I> automaton) {
        if (automaton.isDeterministic()) {
            return automaton;
        }
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(automaton.getInputAlphabet());
        final Registry registry = new SubsetRegistry();
        doDeterminize(automaton.powersetView(), automaton.getInputAlphabet().size(), out, registry);

        LOG.debug("Determinized {} states into {} composite states", automaton.size(), registry.size());
        return out.build();
    }

    private <I> void doDeterminize(PowersetView<I> powerset,
                                   int numSymbols,
                                   AutomatonBuilder<I> out,
                                   Registry registry) {
        final Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        // Add closure of initial states to DFA and to stack
        final BitSet init = powerset.getInitialState();
        final int initOut = out.addInitialState(powerset.isAccepting(init));
        registry.put(init, initOut);
        stack.push(new DeterminizeRecord(init, initOut));

        while (!stack.isEmpty()) {
            final DeterminizeRecord curr = stack.pop();

            for (int sym = 0; sym < numSymbols; sym++) {
                final BitSet succ = powerset.getSuccessor(curr.inputState(), sym);
                if (succ.isEmpty()) {
                    continue; // left undefined, the result may be partial
                }
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to stack
                    outSucc = out.addState(powerset.isAccepting(succ));
                    limit.check(out.size(), "determinize");
                    registry.put(succ, outSucc);
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                out.addTransition(curr.outputState(), sym, outSucc);
            }
        }
    }

    private record DeterminizeRecord(BitSet inputState, int outputState) { }
}
