package FSA;

import java.util.HashMap;
import java.util.Map;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.PreconditionViolationException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Copies automata to and from AutomataLib's compact implementations, e.g. to use its serializers or its
 * equivalence oracle. State ids are preserved when exporting; imported states are numbered in the iteration order of
 * {@code getStates()}.
 */
public class AutomataLibConverter {

    private AutomataLibConverter() {}

    /**
     * Epsilon transitions are removed first, since AutomataLib's NFAs have none.
     */
    public static <I> CompactNFA<I> toCompactNFA(Automaton<I> automaton) {
        final Automaton<I> epsFree = EpsilonRemoval.removeEpsilons(automaton);
        final Alphabet<I> alphabet = epsFree.getInputAlphabet();
        final CompactNFA<I> nfa = new CompactNFA<>(alphabet, epsFree.size());

        for (int s = 0; s < epsFree.size(); s++) {
            nfa.addState(epsFree.isAccepting(s));
        }
        for (int s = 0; s < epsFree.size(); s++) {
            nfa.setInitial(s, epsFree.isInitial(s));
            for (int a = 0; a < alphabet.size(); a++) {
                for (int t : epsFree.getTransitions(s, a)) {
                    nfa.addTransition(s, a, t);
                }
            }
        }
        return nfa;
    }

    /**
     * @throws PreconditionViolationException if {@code automaton} is not deterministic
     */
    public static <I> CompactDFA<I> toCompactDFA(Automaton<I> automaton) {
        if (!automaton.isDeterministic()) {
            throw new PreconditionViolationException("toCompactDFA", "a deterministic automaton");
        }
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final CompactDFA<I> dfa = new CompactDFA<>(alphabet, automaton.size());

        for (int s = 0; s < automaton.size(); s++) {
            dfa.addState(automaton.isAccepting(s));
        }
        dfa.setInitial(automaton.getInitialState(), true);
        for (int s = 0; s < automaton.size(); s++) {
            for (int a = 0; a < alphabet.size(); a++) {
                final int t = automaton.getSuccessor(s, a);
                if (t != Automaton.MISSING_STATE) {
                    dfa.setTransition(s, a, t);
                }
            }
        }
        return dfa;
    }

    /**
     * @param alphabet symbols to copy transitions for; transitions on other symbols are not visible through the
     *                 {@link NFA} interface anyway
     */
    public static <S, I> Automaton<I> fromNFA(NFA<S, I> nfa, Alphabet<I> alphabet) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final Map<S, Integer> ids = new HashMap<>();
        for (S s : nfa.getStates()) {
            ids.put(s, out.addState(nfa.isAccepting(s)));
        }
        for (S s : nfa.getInitialStates()) {
            out.setInitial(ids.get(s), true);
        }
        for (S s : nfa.getStates()) {
            for (int a = 0; a < alphabet.size(); a++) {
                for (S t : nfa.getTransitions(s, alphabet.getSymbol(a))) {
                    out.addTransition(ids.get(s), a, ids.get(t));
                }
            }
        }
        return out.build();
    }

    /**
     * A DFA without initial state is imported as an automaton without initial state, i.e. the empty language.
     */
    public static <S, I> Automaton<I> fromDFA(DFA<S, I> dfa, Alphabet<I> alphabet) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final Map<S, Integer> ids = new HashMap<>();
        for (S s : dfa.getStates()) {
            ids.put(s, out.addState(dfa.isAccepting(s)));
        }
        final S init = dfa.getInitialState();
        if (init != null) {
            out.setInitial(ids.get(init), true);
        }
        for (S s : dfa.getStates()) {
            for (int a = 0; a < alphabet.size(); a++) {
                final S t = dfa.getSuccessor(s, alphabet.getSymbol(a));
                if (t != null) {
                    out.addTransition(ids.get(s), a, ids.get(t));
                }
            }
        }
        return out.build();
    }
}
