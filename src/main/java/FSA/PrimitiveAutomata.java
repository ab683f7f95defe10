package FSA;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import net.automatalib.alphabet.Alphabet;

/**
 * Small deterministic automata for the basic languages everything else is composed from.
 */
public class PrimitiveAutomata {

    private PrimitiveAutomata() {}

    /**
     * @return automaton accepting no word: one non-accepting initial state without transitions
     */
    public static <I> Automaton<I> emptyLanguage(Alphabet<I> alphabet) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        out.addInitialState(false);
        return out.build();
    }

    /**
     * @return automaton accepting only the empty word
     */
    public static <I> Automaton<I> emptyWord(Alphabet<I> alphabet) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        out.addInitialState(true);
        return out.build();
    }

    /**
     * @return automaton accepting only the one-letter word {@code symbol}
     */
    public static <I> Automaton<I> symbol(Alphabet<I> alphabet, I symbol) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final int init = out.addInitialState(false);
        final int fin = out.addState(true);
        out.addTransition(init, symbol, fin);
        return out.build();
    }

    /**
     * @return automaton accepting only {@code word}
     */
    public static <I> Automaton<I> word(Alphabet<I> alphabet, Iterable<? extends I> word) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        int current = out.addInitialState(false);
        for (I symbol : word) {
            final int next = out.addState(false);
            out.addTransition(current, symbol, next);
            current = next;
        }
        out.setAccepting(current, true);
        return out.build();
    }

    /**
     * @return automaton accepting every word of exactly {@code length} symbols
     */
    public static <I> Automaton<I> anyOfLength(Alphabet<I> alphabet, int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Negative length: " + length);
        }
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        int current = out.addInitialState(length == 0);
        for (int i = 1; i <= length; i++) {
            final int next = out.addState(i == length);
            for (int a = 0; a < alphabet.size(); a++) {
                out.addTransition(current, a, next);
            }
            current = next;
        }
        return out.build();
    }

    /**
     * @return complete one-state automaton accepting every word
     */
    public static <I> Automaton<I> universal(Alphabet<I> alphabet) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final int state = out.addInitialState(true);
        for (int a = 0; a < alphabet.size(); a++) {
            out.addTransition(state, a, state);
        }
        return out.build();
    }
}
