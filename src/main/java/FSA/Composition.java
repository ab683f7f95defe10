package FSA;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import net.automatalib.alphabet.Alphabet;

/**
 * Epsilon-based (Thompson-style) compositions. Results are NFAs; operands may be of any kind and are never
 * modified. Binary operations require both operands to have the same symbols and use the left operand's alphabet.
 */
public class Composition {

    private Composition() {}

    /**
     * Sum construction: a fresh initial state with epsilon transitions to the initial states of both operands.
     */
    public static <I> Automaton<I> union(Automaton<I> left, Automaton<I> right) {
        final Alphabet<I> alphabet = left.getInputAlphabet();
        AlphabetUtils.requireSameSymbols(alphabet, right.getInputAlphabet(), "union");

        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final int init = out.addInitialState(false);
        final int leftOffset = AlphabetUtils.copyInto(out, left, AlphabetUtils.identity(alphabet.size()));
        final int rightOffset =
                AlphabetUtils.copyInto(out, right, AlphabetUtils.symbolIndexMap(right.getInputAlphabet(), alphabet));

        for (int i : left.getInitialStates()) {
            out.addEpsilonTransition(init, leftOffset + i);
        }
        for (int i : right.getInitialStates()) {
            out.addEpsilonTransition(init, rightOffset + i);
        }
        return out.build();
    }

    /**
     * Concatenation: accepting states of {@code first} are linked to the initial states of {@code second}. They stay
     * accepting only if {@code second} accepts the empty word.
     */
    public static <I> Automaton<I> concatenate(Automaton<I> first, Automaton<I> second) {
        final Alphabet<I> alphabet = first.getInputAlphabet();
        AlphabetUtils.requireSameSymbols(alphabet, second.getInputAlphabet(), "concatenate");

        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final int firstOffset = AlphabetUtils.copyInto(out, first, AlphabetUtils.identity(alphabet.size()));
        final int secondOffset =
                AlphabetUtils.copyInto(out, second, AlphabetUtils.symbolIndexMap(second.getInputAlphabet(), alphabet));

        for (int i : first.getInitialStates()) {
            out.setInitial(firstOffset + i, true);
        }

        final boolean secondAcceptsEmpty = second.acceptsEmptyWord();
        for (int f : first.getAcceptingStates()) {
            out.setAccepting(firstOffset + f, secondAcceptsEmpty);
            for (int i : second.getInitialStates()) {
                out.addEpsilonTransition(firstOffset + f, secondOffset + i);
            }
        }
        return out.build();
    }

    /**
     * Kleene closure: accepting states loop back to the initial states, and a fresh accepting initial state
     * accepts the empty word.
     */
    public static <I> Automaton<I> star(Automaton<I> automaton) {
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final int init = out.addInitialState(true);
        final int offset = AlphabetUtils.copyInto(out, automaton, AlphabetUtils.identity(alphabet.size()));

        for (int i : automaton.getInitialStates()) {
            out.addEpsilonTransition(init, offset + i);
            for (int f : automaton.getAcceptingStates()) {
                out.addEpsilonTransition(offset + f, offset + i);
            }
        }
        return out.build();
    }

    /**
     * One or more repetitions.
     */
    public static <I> Automaton<I> plus(Automaton<I> automaton) {
        return concatenate(automaton, star(automaton));
    }

    /**
     * Zero or one occurrence.
     */
    public static <I> Automaton<I> optional(Automaton<I> automaton) {
        return union(automaton, PrimitiveAutomata.emptyWord(automaton.getInputAlphabet()));
    }

    /**
     * At least {@code min} repetitions.
     */
    public static <I> Automaton<I> atLeast(Automaton<I> automaton, int min) {
        return concatenate(power(automaton, min), star(automaton));
    }

    /**
     * At most {@code max} repetitions (including zero).
     */
    public static <I> Automaton<I> atMost(Automaton<I> automaton, int max) {
        return power(optional(automaton), max);
    }

    /**
     * Between {@code min} and {@code max} repetitions, both inclusive. A negative {@code max} means unbounded;
     * {@code max < min} yields the empty language.
     */
    public static <I> Automaton<I> repeat(Automaton<I> automaton, int min, int max) {
        if (min < 0) {
            throw new IllegalArgumentException("Negative repetition count: " + min);
        }
        if (max < 0) {
            return atLeast(automaton, min);
        }
        if (max < min) {
            return PrimitiveAutomata.emptyLanguage(automaton.getInputAlphabet());
        }
        return concatenate(power(automaton, min), atMost(automaton, max - min));
    }

    /**
     * Exactly {@code n} repetitions; the empty-word automaton for {@code n == 0}.
     */
    public static <I> Automaton<I> power(Automaton<I> automaton, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Negative repetition count: " + n);
        }
        Automaton<I> result = PrimitiveAutomata.emptyWord(automaton.getInputAlphabet());
        for (int i = 0; i < n; i++) {
            result = concatenate(result, automaton);
        }
        return result;
    }
}
