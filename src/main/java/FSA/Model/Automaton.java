package FSA.Model;

import java.util.BitSet;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.concept.FiniteRepresentation;
import net.automatalib.automaton.concept.InputAlphabetHolder;

/**
 * Immutable finite word automaton over a fixed alphabet.
 * <p>
 * States are the integers {@code 0 .. size()-1} and have no meaning outside this instance. Transitions are stored
 * per (state, symbol index); epsilon transitions are stored per state. The same class represents NFAs and DFAs: the
 * determinism and completeness flags are derived from the structure when the automaton is built.
 * <p>
 * Instances are created through {@link AutomatonBuilder}, which rejects references to unknown states or symbols.
 *
 * @param <I> input symbol type
 */
public final class Automaton<I> implements InputAlphabetHolder<I>, FiniteRepresentation {

    /** Returned by {@link #getSuccessor(int, int)} when a deterministic automaton has no transition. */
    public static final int MISSING_STATE = -1;

    private final Alphabet<I> alphabet;
    private final int size;
    private final int[][][] transitions; // [state][symbolIndex] -> sorted successors
    private final int[][] epsilonTransitions; // [state] -> sorted successors
    private final BitSet initialStates;
    private final BitSet acceptingStates;
    private final boolean deterministic;
    private final boolean complete;
    private final int transitionCount;

    Automaton(Alphabet<I> alphabet,
              int[][][] transitions,
              int[][] epsilonTransitions,
              BitSet initialStates,
              BitSet acceptingStates) {
        this.alphabet = alphabet;
        this.size = transitions.length;
        this.transitions = transitions;
        this.epsilonTransitions = epsilonTransitions;
        this.initialStates = initialStates;
        this.acceptingStates = acceptingStates;

        boolean epsilonFree = true;
        boolean atMostOne = true;
        boolean exactlyOne = size > 0;
        int count = 0;
        for (int s = 0; s < size; s++) {
            if (epsilonTransitions[s].length > 0) {
                epsilonFree = false;
                count += epsilonTransitions[s].length;
            }
            for (int[] succs : transitions[s]) {
                count += succs.length;
                atMostOne &= succs.length <= 1;
                exactlyOne &= succs.length == 1;
            }
        }
        this.deterministic = epsilonFree && atMostOne && initialStates.cardinality() == 1;
        this.complete = epsilonFree && exactlyOne;
        this.transitionCount = count;
    }

    @Override
    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * @return true iff there is exactly one initial state, no epsilon transition and at most one successor per
     * (state, symbol)
     */
    public boolean isDeterministic() {
        return deterministic;
    }

    /**
     * @return true iff there is at least one state, no epsilon transition and exactly one successor per
     * (state, symbol)
     */
    public boolean isComplete() {
        return complete;
    }

    public boolean hasEpsilonTransitions() {
        for (int[] eps : epsilonTransitions) {
            if (eps.length > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return number of (state, symbol-or-epsilon, successor) triples
     */
    public int transitionCount() {
        return transitionCount;
    }

    public boolean isInitial(int state) {
        checkState(state);
        return initialStates.get(state);
    }

    public boolean isAccepting(int state) {
        checkState(state);
        return acceptingStates.get(state);
    }

    public IntList getInitialStates() {
        return toList(initialStates);
    }

    public IntList getAcceptingStates() {
        return toList(acceptingStates);
    }

    /**
     * @return a copy of the initial state set
     */
    public BitSet initialStateSet() {
        return (BitSet) initialStates.clone();
    }

    /**
     * @return a copy of the accepting state set
     */
    public BitSet acceptingStateSet() {
        return (BitSet) acceptingStates.clone();
    }

    /**
     * @return the single initial state of a deterministic automaton
     * @throws PreconditionViolationException if the automaton is not deterministic
     */
    public int getInitialState() {
        requireDeterministic("getInitialState");
        return initialStates.nextSetBit(0);
    }

    /**
     * For {@code Character} or {@code Integer} alphabets, a primitive {@code char}/{@code int} argument selects
     * {@link #getTransitions(int, int)}; pass a boxed value to address a symbol.
     */
    public IntList getTransitions(int state, I symbol) {
        return getTransitions(state, symbolIndex(symbol));
    }

    /**
     * @param symbolIndex index of the symbol in the alphabet
     */
    public IntList getTransitions(int state, int symbolIndex) {
        checkState(state);
        checkSymbolIndex(symbolIndex);
        return IntLists.unmodifiable(IntArrayList.wrap(transitions[state][symbolIndex]));
    }

    public IntList getEpsilonTransitions(int state) {
        checkState(state);
        return IntLists.unmodifiable(IntArrayList.wrap(epsilonTransitions[state]));
    }

    /**
     * @return the successor of a deterministic automaton, or {@link #MISSING_STATE} if undefined
     * @throws PreconditionViolationException if the automaton is not deterministic
     */
    public int getSuccessor(int state, int symbolIndex) {
        requireDeterministic("getSuccessor");
        checkState(state);
        checkSymbolIndex(symbolIndex);
        final int[] succs = transitions[state][symbolIndex];
        return succs.length == 0 ? MISSING_STATE : succs[0];
    }

    /**
     * @return a powerset (subset) view of this automaton, with epsilon closure applied on every step
     */
    public PowersetView<I> powersetView() {
        return new PowersetView<>(this);
    }

    /**
     * Runs the automaton on a word. A symbol outside the alphabet rejects the word.
     *
     * @param word input symbols
     * @return whether the word is in the language of this automaton
     */
    public boolean accepts(Iterable<? extends I> word) {
        final PowersetView<I> powerset = powersetView();
        BitSet current = powerset.getInitialState();
        for (I symbol : word) {
            if (current.isEmpty() || !alphabet.contains(symbol)) {
                return false;
            }
            current = powerset.getSuccessor(current, alphabet.getSymbolIndex(symbol));
        }
        return powerset.isAccepting(current);
    }

    public boolean acceptsEmptyWord() {
        final PowersetView<I> powerset = powersetView();
        return powerset.isAccepting(powerset.getInitialState());
    }

    int[] successorArray(int state, int symbolIndex) {
        return transitions[state][symbolIndex];
    }

    int[] epsilonArray(int state) {
        return epsilonTransitions[state];
    }

    private int symbolIndex(I symbol) {
        if (!alphabet.contains(symbol)) {
            throw MalformedAutomatonException.unknownSymbol(symbol);
        }
        return alphabet.getSymbolIndex(symbol);
    }

    private void checkState(int state) {
        if (state < 0 || state >= size) {
            throw MalformedAutomatonException.unknownState(state, size);
        }
    }

    private void checkSymbolIndex(int symbolIndex) {
        if (symbolIndex < 0 || symbolIndex >= alphabet.size()) {
            throw new MalformedAutomatonException("Symbol index " + symbolIndex + " is not in [0, "
                                                  + alphabet.size() + ")");
        }
    }

    private void requireDeterministic(String operation) {
        if (!deterministic) {
            throw new PreconditionViolationException(operation, "a deterministic automaton");
        }
    }

    private static IntList toList(BitSet states) {
        final IntArrayList result = new IntArrayList(states.cardinality());
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            result.add(s);
        }
        return IntLists.unmodifiable(result);
    }

    @Override
    public String toString() {
        return "Automaton{states=" + size + ", initial=" + initialStates + ", accepting=" + acceptingStates
               + ", transitions=" + transitionCount + ", deterministic=" + deterministic + ", complete=" + complete
               + '}';
    }
}
