package FSA.Regex;

import FSA.Composition;
import FSA.Model.AlphabetMismatchException;
import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.PrimitiveAutomata;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a {@link Regex} into an epsilon-NFA by structural recursion. The result is never assumed to be
 * deterministic, even where it happens to be.
 */
public class ThompsonConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(ThompsonConstruction.class);

    private ThompsonConstruction() {}

    /**
     * @param regex expression to translate
     * @param alphabet alphabet of the result; must contain every literal of {@code regex}
     * @return NFA accepting the language of {@code regex}
     * @throws AlphabetMismatchException if a literal is not part of {@code alphabet}
     */
    public static <I> Automaton<I> toNFA(Regex<I> regex, Alphabet<I> alphabet) {
        for (I symbol : regex.symbols()) {
            if (!alphabet.contains(symbol)) {
                throw new AlphabetMismatchException("fromRegex: literal '" + symbol + "' is not in the alphabet "
                                                    + alphabet);
            }
        }
        final Automaton<I> result = build(regex, alphabet);
        LOG.debug("Built NFA with {} states, {} transitions from {}", result.size(), result.transitionCount(), regex);
        return result;
    }

    private static <I> Automaton<I> build(Regex<I> regex, Alphabet<I> alphabet) {
        return switch (regex.kind()) {
            case EMPTY -> emptyPair(alphabet);
            case EPSILON -> epsilonPair(alphabet);
            case LITERAL -> PrimitiveAutomata.symbol(alphabet, regex.symbol());
            case UNION -> Composition.union(build(regex.left(), alphabet), build(regex.right(), alphabet));
            case CONCAT -> Composition.concatenate(build(regex.left(), alphabet), build(regex.right(), alphabet));
            case STAR -> Composition.star(build(regex.inner(), alphabet));
        };
    }

    // 0 and 1 unconnected, 1 accepting
    private static <I> Automaton<I> emptyPair(Alphabet<I> alphabet) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        out.addInitialState(false);
        out.addState(true);
        return out.build();
    }

    // 0 -ε-> 1
    private static <I> Automaton<I> epsilonPair(Alphabet<I> alphabet) {
        final AutomatonBuilder<I> out = new AutomatonBuilder<>(alphabet);
        final int init = out.addInitialState(false);
        final int fin = out.addState(true);
        out.addEpsilonTransition(init, fin);
        return out.build();
    }
}
