package FSA;

import FSA.Model.AlphabetMismatchException;
import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.PreconditionViolationException;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Completion {
    private static final Logger LOG = LoggerFactory.getLogger(Completion.class);

    private Completion() {}

    /**
     * Route every undefined (state, symbol) pair to a fresh non-accepting sink with self-loops.
     * Complete input is returned as is.
     *
     * @param dfa deterministic automaton
     * @return complete deterministic automaton with the same language
     * @throws PreconditionViolationException if {@code dfa} is not deterministic
     */
    public static <I> Automaton<I> complete(Automaton<I> dfa) {
        if (!dfa.isDeterministic()) {
            throw new PreconditionViolationException("complete", "a deterministic automaton");
        }
        if (dfa.isComplete()) {
            return dfa;
        }
        final int numSymbols = dfa.getInputAlphabet().size();
        final AutomatonBuilder<I> out = AutomatonBuilder.copyOf(dfa);
        final int sink = out.addState(false);
        for (int s = 0; s <= sink; s++) {
            for (int a = 0; a < numSymbols; a++) {
                if (!out.hasTransition(s, a)) {
                    out.addTransition(s, a, sink);
                }
            }
        }
        return out.build();
    }

    /**
     * Determinize (if needed) and complete.
     */
    public static <I> Automaton<I> toCompleteDFA(Automaton<I> automaton) {
        if (automaton.isDeterministic() && automaton.isComplete()) {
            return automaton;
        }
        if (!automaton.isDeterministic()) {
            LOG.debug("Determinizing automaton with {} states before completion", automaton.size());
        }
        return complete(PowersetDeterminizer.determinize(automaton));
    }

    /**
     * Complement with respect to the automaton's alphabet. Input that is not a complete DFA is determinized and
     * completed first, so any automaton is accepted.
     *
     * @return complete deterministic automaton accepting exactly the words {@code automaton} rejects
     */
    public static <I> Automaton<I> complement(Automaton<I> automaton) {
        final Automaton<I> dfa = toCompleteDFA(automaton);
        final AutomatonBuilder<I> out = AutomatonBuilder.copyOf(dfa);
        for (int s = 0; s < dfa.size(); s++) {
            out.setAccepting(s, !dfa.isAccepting(s));
        }
        return out.build();
    }

    /**
     * Re-express {@code automaton} over a larger alphabet. The additional symbols have no transitions, i.e. any
     * word containing them is rejected. This is the explicit way to combine automata over different alphabets.
     *
     * @throws AlphabetMismatchException if {@code wider} lacks a symbol of the automaton's alphabet
     */
    public static <I> Automaton<I> extendAlphabet(Automaton<I> automaton, Alphabet<I> wider) {
        return AlphabetUtils.reindex(automaton, wider);
    }
}
