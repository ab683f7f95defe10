package FSA;

import FSA.Model.Automaton;
import FSA.Model.StateLimit;
import FSA.Regex.Regex;
import FSA.Regex.ThompsonConstruction;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.word.Word;

/**
 * Entry point to the algebra of regular languages over {@link Automaton} values.
 * <p>
 * All operations are pure: operands are never modified and results have fresh state ids. Unless stated otherwise,
 * binary operations require both operands to have the same symbols (in any order) and throw
 * {@link FSA.Model.AlphabetMismatchException} otherwise; use {@link #extendAlphabet(Automaton, Alphabet)} to combine
 * automata over different alphabets. Operations that need a complete DFA determinize and complete their operands
 * themselves, with the exception of {@link #complete(Automaton)}, which requires a deterministic operand.
 */
public class FiniteAutomata {

    private FiniteAutomata() {}

    /**
     * @throws FSA.Model.AlphabetMismatchException if a literal is not in {@code alphabet}
     */
    public static <I> Automaton<I> fromRegex(Regex<I> regex, Alphabet<I> alphabet) {
        return ThompsonConstruction.toNFA(regex, alphabet);
    }

    public static <I> Automaton<I> determinize(Automaton<I> automaton) {
        return PowersetDeterminizer.determinize(automaton);
    }

    /**
     * @throws FSA.Model.StateLimitExceededException if more than {@code limit} states are reachable
     */
    public static <I> Automaton<I> determinize(Automaton<I> automaton, StateLimit limit) {
        return new PowersetDeterminizer(limit).apply(automaton);
    }

    public static <I> Automaton<I> removeEpsilons(Automaton<I> automaton) {
        return EpsilonRemoval.removeEpsilons(automaton);
    }

    /**
     * @throws FSA.Model.PreconditionViolationException if {@code dfa} is not deterministic
     */
    public static <I> Automaton<I> complete(Automaton<I> dfa) {
        return Completion.complete(dfa);
    }

    public static <I> Automaton<I> complement(Automaton<I> automaton) {
        return Completion.complement(automaton);
    }

    public static <I> Automaton<I> extendAlphabet(Automaton<I> automaton, Alphabet<I> wider) {
        return Completion.extendAlphabet(automaton, wider);
    }

    /**
     * Epsilon-NFA union; see {@link #productUnion(Automaton, Automaton)} for a DFA result.
     */
    public static <I> Automaton<I> union(Automaton<I> left, Automaton<I> right) {
        return Composition.union(left, right);
    }

    public static <I> Automaton<I> productUnion(Automaton<I> left, Automaton<I> right) {
        return ProductConstruction.productUnion(left, right);
    }

    public static <I> Automaton<I> intersection(Automaton<I> left, Automaton<I> right) {
        return ProductConstruction.intersection(left, right);
    }

    /**
     * @throws FSA.Model.StateLimitExceededException if more than {@code limit} pairs are reachable
     */
    public static <I> Automaton<I> intersection(Automaton<I> left, Automaton<I> right, StateLimit limit) {
        return new ProductConstruction(limit).apply(left, right, ProductConstruction.Acceptance.INTERSECTION);
    }

    public static <I> Automaton<I> difference(Automaton<I> left, Automaton<I> right) {
        return ProductConstruction.difference(left, right);
    }

    public static <I> Automaton<I> symmetricDifference(Automaton<I> left, Automaton<I> right) {
        return ProductConstruction.symmetricDifference(left, right);
    }

    public static <I> Automaton<I> concatenate(Automaton<I> first, Automaton<I> second) {
        return Composition.concatenate(first, second);
    }

    public static <I> Automaton<I> star(Automaton<I> automaton) {
        return Composition.star(automaton);
    }

    public static <I> Automaton<I> plus(Automaton<I> automaton) {
        return Composition.plus(automaton);
    }

    public static <I> Automaton<I> optional(Automaton<I> automaton) {
        return Composition.optional(automaton);
    }

    /**
     * @param max upper bound, negative for unbounded
     */
    public static <I> Automaton<I> repeat(Automaton<I> automaton, int min, int max) {
        return Composition.repeat(automaton, min, max);
    }

    public static <I> Automaton<I> minimize(Automaton<I> automaton) {
        return Minimizer.minimize(automaton);
    }

    public static <I> Automaton<I> accessible(Automaton<I> automaton) {
        return NFATrim.accessible(automaton);
    }

    public static <I> Automaton<I> coAccessible(Automaton<I> automaton) {
        return NFATrim.coAccessible(automaton);
    }

    public static <I> Automaton<I> trim(Automaton<I> automaton) {
        return NFATrim.trim(automaton);
    }

    public static <I> Automaton<I> reverse(Automaton<I> automaton) {
        return NFATrim.reverse(automaton);
    }

    public static <I> boolean equivalent(Automaton<I> left, Automaton<I> right) {
        return Equivalence.equivalent(left, right);
    }

    /**
     * @return true iff {@code L(sub) ⊆ L(sup)}
     */
    public static <I> boolean includes(Automaton<I> sup, Automaton<I> sub) {
        return Equivalence.includes(sup, sub);
    }

    public static <I> boolean isEmpty(Automaton<I> automaton) {
        return Equivalence.isEmpty(automaton);
    }

    public static <I> boolean isUniversal(Automaton<I> automaton) {
        return Equivalence.isUniversal(automaton);
    }

    public static <I> Word<I> findSeparatingWord(Automaton<I> left, Automaton<I> right) {
        return Equivalence.findSeparatingWord(left, right);
    }
}
