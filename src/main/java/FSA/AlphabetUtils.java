package FSA;

import FSA.Model.AlphabetMismatchException;
import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import net.automatalib.alphabet.Alphabet;

public class AlphabetUtils {

    private AlphabetUtils() {}

    /**
     * Determine whether both alphabets contain exactly the same symbols, in any order.
     */
    public static <I> boolean sameSymbols(Alphabet<I> left, Alphabet<I> right) {
        if (left == right) {
            return true;
        }
        if (left.size() != right.size()) {
            return false;
        }
        for (I symbol : left) {
            if (!right.contains(symbol)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws AlphabetMismatchException if the alphabets do not contain the same symbols
     */
    public static <I> void requireSameSymbols(Alphabet<I> left, Alphabet<I> right, String operation) {
        if (!sameSymbols(left, right)) {
            throw AlphabetMismatchException.of(operation, left, right);
        }
    }

    /**
     * Index translation table: {@code result[i]} is the index in {@code to} of symbol {@code i} of {@code from}.
     * Every symbol of {@code from} must be in {@code to}.
     */
    public static <I> int[] symbolIndexMap(Alphabet<I> from, Alphabet<I> to) {
        final int[] map = new int[from.size()];
        for (int i = 0; i < map.length; i++) {
            final I symbol = from.getSymbol(i);
            if (!to.contains(symbol)) {
                throw AlphabetMismatchException.of("symbolIndexMap", from, to);
            }
            map[i] = to.getSymbolIndex(symbol);
        }
        return map;
    }

    /**
     * Re-express {@code automaton} over {@code target}, which must contain every symbol of the automaton's alphabet.
     * Symbols of {@code target} unknown to the automaton get no transition. Returns the automaton itself if its
     * alphabet already is {@code target}.
     */
    public static <I> Automaton<I> reindex(Automaton<I> automaton, Alphabet<I> target) {
        final Alphabet<I> source = automaton.getInputAlphabet();
        if (source == target) {
            return automaton;
        }
        final int[] map = symbolIndexMap(source, target);
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(target);
        copyInto(out, automaton, map);
        for (int s : automaton.getInitialStates()) {
            out.setInitial(s, true);
        }
        return out.build();
    }

    /**
     * Copy every state (with its accepting flag, not its initial flag) and transition of {@code automaton} into
     * {@code out}, translating symbol indices through {@code symbolMap}.
     *
     * @return offset of the copied states: state {@code s} of {@code automaton} is {@code offset + s} in {@code out}
     */
    static <I> int copyInto(AutomatonBuilder<I> out, Automaton<I> automaton, int[] symbolMap) {
        final int offset = out.size();
        for (int s = 0; s < automaton.size(); s++) {
            out.addState(automaton.isAccepting(s));
        }
        for (int s = 0; s < automaton.size(); s++) {
            for (int a = 0; a < symbolMap.length; a++) {
                for (int t : automaton.getTransitions(s, a)) {
                    out.addTransition(offset + s, symbolMap[a], offset + t);
                }
            }
            for (int t : automaton.getEpsilonTransitions(s)) {
                out.addEpsilonTransition(offset + s, offset + t);
            }
        }
        return offset;
    }

    static int[] identity(int size) {
        final int[] map = new int[size];
        for (int i = 0; i < size; i++) {
            map[i] = i;
        }
        return map;
    }
}
