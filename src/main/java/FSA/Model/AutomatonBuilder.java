package FSA.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.GrowingAlphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Mutable construction site for an {@link Automaton}. Every call is validated immediately, so {@link #build()}
 * can only produce well-formed automata. A builder may be reused after {@code build()}; built automata are not
 * affected by later modifications.
 * <p>
 * A {@link GrowingAlphabet} is copied on construction, so symbols added to it afterwards are not part of the
 * automaton's alphabet.
 *
 * @param <I> input symbol type
 */
public final class AutomatonBuilder<I> {

    private static final int[] NO_STATES = new int[0];

    private final Alphabet<I> alphabet;
    private final int numSymbols;
    private final List<IntSortedSet[]> transitions = new ArrayList<>();
    private final List<IntSortedSet> epsilonTransitions = new ArrayList<>();
    private final BitSet initialStates = new BitSet();
    private final BitSet acceptingStates = new BitSet();

    public AutomatonBuilder(Alphabet<I> alphabet) {
        if (alphabet == null) {
            throw new MalformedAutomatonException("Alphabet must not be null");
        }
        this.alphabet = alphabet instanceof GrowingAlphabet ? Alphabets.fromCollection(alphabet) : alphabet;
        this.numSymbols = this.alphabet.size();
    }

    /**
     * @return a builder pre-populated with the states and transitions of {@code automaton}, same state ids
     */
    public static <I> AutomatonBuilder<I> copyOf(Automaton<I> automaton) {
        final AutomatonBuilder<I> builder = new AutomatonBuilder<>(automaton.getInputAlphabet());
        for (int s = 0; s < automaton.size(); s++) {
            builder.addState(automaton.isAccepting(s));
            builder.setInitial(s, automaton.isInitial(s));
        }
        for (int s = 0; s < automaton.size(); s++) {
            for (int a = 0; a < builder.numSymbols; a++) {
                for (int t : automaton.successorArray(s, a)) {
                    builder.addTransition(s, a, t);
                }
            }
            for (int t : automaton.epsilonArray(s)) {
                builder.addEpsilonTransition(s, t);
            }
        }
        return builder;
    }

    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    public int size() {
        return transitions.size();
    }

    public int addState(boolean accepting) {
        final int id = transitions.size();
        transitions.add(new IntSortedSet[numSymbols]);
        epsilonTransitions.add(null);
        acceptingStates.set(id, accepting);
        return id;
    }

    public int addInitialState(boolean accepting) {
        final int id = addState(accepting);
        initialStates.set(id);
        return id;
    }

    public AutomatonBuilder<I> setInitial(int state, boolean initial) {
        checkState(state);
        initialStates.set(state, initial);
        return this;
    }

    public AutomatonBuilder<I> setAccepting(int state, boolean accepting) {
        checkState(state);
        acceptingStates.set(state, accepting);
        return this;
    }

    public boolean isAccepting(int state) {
        checkState(state);
        return acceptingStates.get(state);
    }

    /**
     * Add a transition on {@code symbol}. For {@code Character} or {@code Integer} alphabets, a primitive
     * {@code char}/{@code int} argument selects {@link #addTransition(int, int, int)} instead; pass a boxed value to
     * address a symbol.
     */
    public AutomatonBuilder<I> addTransition(int source, I symbol, int target) {
        if (!alphabet.contains(symbol)) {
            throw MalformedAutomatonException.unknownSymbol(symbol);
        }
        return addTransition(source, alphabet.getSymbolIndex(symbol), target);
    }

    /**
     * Add a transition on the symbol at {@code symbolIndex} in the alphabet, not on a symbol equal to it.
     */
    public AutomatonBuilder<I> addTransition(int source, int symbolIndex, int target) {
        checkState(source);
        checkState(target);
        checkSymbolIndex(symbolIndex);
        final IntSortedSet[] row = transitions.get(source);
        if (row[symbolIndex] == null) {
            row[symbolIndex] = new IntRBTreeSet();
        }
        row[symbolIndex].add(target);
        return this;
    }

    public AutomatonBuilder<I> addEpsilonTransition(int source, int target) {
        checkState(source);
        checkState(target);
        IntSortedSet eps = epsilonTransitions.get(source);
        if (eps == null) {
            eps = new IntRBTreeSet();
            epsilonTransitions.set(source, eps);
        }
        eps.add(target);
        return this;
    }

    public boolean hasTransition(int source, int symbolIndex) {
        checkState(source);
        checkSymbolIndex(symbolIndex);
        final IntSortedSet succs = transitions.get(source)[symbolIndex];
        return succs != null && !succs.isEmpty();
    }

    public Automaton<I> build() {
        final int size = transitions.size();
        final int[][][] trans = new int[size][numSymbols][];
        final int[][] eps = new int[size][];
        for (int s = 0; s < size; s++) {
            final IntSortedSet[] row = transitions.get(s);
            for (int a = 0; a < numSymbols; a++) {
                trans[s][a] = toArray(row[a]);
            }
            eps[s] = toArray(epsilonTransitions.get(s));
        }
        return new Automaton<>(alphabet, trans, eps, (BitSet) initialStates.clone(),
                               (BitSet) acceptingStates.clone());
    }

    private static int[] toArray(IntSortedSet set) {
        return set == null || set.isEmpty() ? NO_STATES : set.toIntArray();
    }

    private void checkState(int state) {
        if (state < 0 || state >= transitions.size()) {
            throw MalformedAutomatonException.unknownState(state, transitions.size());
        }
    }

    private void checkSymbolIndex(int symbolIndex) {
        if (symbolIndex < 0 || symbolIndex >= numSymbols) {
            throw new MalformedAutomatonException("Symbol index " + symbolIndex + " is not in [0, " + numSymbols
                                                  + ")");
        }
    }
}
