package FSA;

import java.util.BitSet;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.PowersetView;

public class EpsilonRemoval {

    private EpsilonRemoval() {}

    /**
     * Produce an equivalent automaton without epsilon transitions, on the same states.
     * State {@code s} gets every symbol transition leaving its epsilon closure, and accepts iff its closure
     * contains an accepting state. Epsilon-free input is returned unchanged.
     */
    public static <I> Automaton<I> removeEpsilons(Automaton<I> automaton) {
        if (!automaton.hasEpsilonTransitions()) {
            return automaton;
        }
        final PowersetView<I> powerset = automaton.powersetView();
        final int numSymbols = automaton.getInputAlphabet().size();
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(automaton.getInputAlphabet());

        final BitSet[] closures = new BitSet[automaton.size()];
        for (int s = 0; s < automaton.size(); s++) {
            final BitSet single = new BitSet();
            single.set(s);
            closures[s] = powerset.epsilonClosure(single);
            out.addState(powerset.isAccepting(closures[s]));
            out.setInitial(s, automaton.isInitial(s));
        }

        for (int s = 0; s < automaton.size(); s++) {
            final BitSet closure = closures[s];
            for (int q = closure.nextSetBit(0); q >= 0; q = closure.nextSetBit(q + 1)) {
                for (int a = 0; a < numSymbols; a++) {
                    for (int t : automaton.getTransitions(q, a)) {
                        out.addTransition(s, a, t);
                    }
                }
            }
        }
        return out.build();
    }
}
