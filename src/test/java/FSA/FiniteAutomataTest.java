package FSA;

import java.util.List;

import FSA.Model.AlphabetMismatchException;
import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.PreconditionViolationException;
import FSA.Model.StateLimit;
import FSA.Model.StateLimitExceededException;
import FSA.Regex.Regex;
import net.automatalib.alphabet.Alphabet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FiniteAutomataTest {
  private static final Alphabet<Character> ABC = LanguageUtils.ABC;

  private static Automaton<Character> regex(Regex<Character> regex) {
    return FiniteAutomata.fromRegex(regex, ABC);
  }

  @Test
  void testStarExample() {
    Automaton<Character> star = FiniteAutomata.star(regex(Regex.literal('a')));
    for (String accepted : List.of("", "a", "aa", "aaa")) {
      Assertions.assertTrue(star.accepts(LanguageUtils.word(accepted)), accepted);
    }
    for (String rejected : List.of("b", "ab")) {
      Assertions.assertFalse(star.accepts(LanguageUtils.word(rejected)), rejected);
    }
  }

  @Test
  void testUnionIntersectionExample() {
    Automaton<Character> a = regex(Regex.union(Regex.literal('a'), Regex.literal('b')));
    Automaton<Character> b = regex(Regex.union(Regex.literal('b'), Regex.literal('c')));
    Automaton<Character> union = FiniteAutomata.union(a, b);
    Automaton<Character> intersection = FiniteAutomata.intersection(a, b);

    Assertions.assertTrue(FiniteAutomata.equivalent(union, LanguageUtils.finite(ABC, "a", "b", "c")));
    Assertions.assertTrue(FiniteAutomata.equivalent(intersection, LanguageUtils.finite(ABC, "b")));
    Assertions.assertTrue(FiniteAutomata.equivalent(union, FiniteAutomata.productUnion(a, b)));

    Automaton<Character> empty = regex(Regex.empty());
    Assertions.assertTrue(FiniteAutomata.equivalent(a, FiniteAutomata.union(a, empty)));
    Assertions.assertTrue(FiniteAutomata.isEmpty(FiniteAutomata.intersection(a, empty)));
  }

  @Test
  void testEndToEndExample() {
    Regex<Character> r = Regex.concat(Regex.literal('a'), Regex.star(Regex.union(Regex.literal('b'), Regex.literal('c'))));
    Automaton<Character> min = FiniteAutomata.minimize(FiniteAutomata.determinize(FiniteAutomata.fromRegex(r, ABC)));

    AutomatonBuilder<Character> builder = new AutomatonBuilder<>(ABC);
    int q0 = builder.addInitialState(false);
    int q1 = builder.addState(true);
    Character a = 'a';
    Character b = 'b';
    Character c = 'c';
    builder.addTransition(q0, a, q1);
    builder.addTransition(q1, b, q1);
    builder.addTransition(q1, c, q1);

    Assertions.assertTrue(FiniteAutomata.equivalent(min, builder.build()));
  }

  @Test
  void testLanguagePreservation() {
    for (int seed = 0; seed < 25; seed++) {
      Automaton<Integer> nfa = TabakovVardiRandomNFA.getRandomEpsilonAutomaton(seed, 7);
      Automaton<Integer> dfa = FiniteAutomata.determinize(nfa);
      Automaton<Integer> min = FiniteAutomata.minimize(nfa);

      Assertions.assertTrue(FiniteAutomata.equivalent(nfa, dfa));
      Assertions.assertTrue(FiniteAutomata.equivalent(nfa, FiniteAutomata.trim(nfa)));
      Assertions.assertTrue(FiniteAutomata.equivalent(nfa, min));
      Assertions.assertTrue(FiniteAutomata.equivalent(nfa, FiniteAutomata.removeEpsilons(nfa)));
      Assertions.assertTrue(FiniteAutomata.equivalent(nfa, FiniteAutomata.reverse(FiniteAutomata.reverse(nfa))));
      Assertions.assertTrue(FiniteAutomata.equivalent(nfa, FiniteAutomata.complement(FiniteAutomata.complement(nfa))));

      Assertions.assertTrue(min.size() <= FiniteAutomata.complete(FiniteAutomata.accessible(dfa)).size());
      Assertions.assertEquals(min.size(), FiniteAutomata.minimize(min).size());
      Assertions.assertTrue(FiniteAutomata.accessible(nfa).size() <= nfa.size());
      Assertions.assertTrue(FiniteAutomata.coAccessible(nfa).size() <= nfa.size());
    }
  }

  @Test
  void testDeMorgan() {
    for (int seed = 0; seed < 15; seed++) {
      Automaton<Integer> a = TabakovVardiRandomNFA.getRandomAutomaton(seed, 5);
      Automaton<Integer> b = TabakovVardiRandomNFA.getRandomAutomaton(seed + 50, 5);
      Automaton<Integer> lhs = FiniteAutomata.complement(FiniteAutomata.union(a, b));
      Automaton<Integer> rhs = FiniteAutomata.intersection(FiniteAutomata.complement(a), FiniteAutomata.complement(b));
      Assertions.assertTrue(FiniteAutomata.equivalent(lhs, rhs));

      Automaton<Integer> diff = FiniteAutomata.difference(a, b);
      Assertions.assertTrue(FiniteAutomata.includes(a, diff));
      Assertions.assertTrue(FiniteAutomata.isEmpty(FiniteAutomata.intersection(diff, b)));
      Assertions.assertEquals(FiniteAutomata.equivalent(a, b),
                              FiniteAutomata.isEmpty(FiniteAutomata.symmetricDifference(a, b)));
    }
  }

  @Test
  void testRepetitionOperators() {
    Automaton<Character> a = regex(Regex.literal('a'));
    Assertions.assertTrue(FiniteAutomata.equivalent(FiniteAutomata.plus(a), regex(Regex.plus(Regex.literal('a')))));
    Assertions.assertTrue(FiniteAutomata.equivalent(FiniteAutomata.optional(a),
                                                    regex(Regex.optional(Regex.literal('a')))));
    Assertions.assertTrue(FiniteAutomata.equivalent(FiniteAutomata.repeat(a, 1, 2),
                                                    LanguageUtils.finite(ABC, "a", "aa")));
    Assertions.assertTrue(FiniteAutomata.equivalent(FiniteAutomata.concatenate(a, a),
                                                    LanguageUtils.finite(ABC, "aa")));
    Assertions.assertTrue(FiniteAutomata.isUniversal(regex(Regex.star(Regex.any(ABC)))));
  }

  @Test
  void testErrorPolicies() {
    Automaton<Character> nfa = regex(Regex.union(Regex.literal('a'), Regex.literal('b')));
    Assertions.assertThrows(PreconditionViolationException.class, () -> FiniteAutomata.complete(nfa));
    Assertions.assertThrows(AlphabetMismatchException.class,
                            () -> FiniteAutomata.fromRegex(Regex.literal('d'), ABC));

    Automaton<Character> ab = FiniteAutomata.fromRegex(Regex.literal('a'), LanguageUtils.AB);
    Assertions.assertThrows(AlphabetMismatchException.class, () -> FiniteAutomata.intersection(nfa, ab));
    Assertions.assertThrows(AlphabetMismatchException.class, () -> FiniteAutomata.equivalent(nfa, ab));
    Assertions.assertTrue(FiniteAutomata.includes(nfa, FiniteAutomata.extendAlphabet(ab, ABC)));

    Automaton<Character> big = regex(Regex.concat(Regex.star(Regex.any(ABC)),
                                                   Regex.concat(Regex.literal('a'), Regex.concat(Regex.any(ABC),
                                                                                                  Regex.any(ABC)))));
    Assertions.assertThrows(StateLimitExceededException.class,
                            () -> FiniteAutomata.determinize(big, StateLimit.of(4)));
    Assertions.assertThrows(StateLimitExceededException.class,
                            () -> FiniteAutomata.intersection(big, big, StateLimit.of(4)));
  }

  @Test
  void testSeparatingWord() {
    Automaton<Character> ab = regex(Regex.word('a', 'b'));
    Automaton<Character> abStar = regex(Regex.star(Regex.word('a', 'b')));
    Assertions.assertEquals(List.of(), FiniteAutomata.findSeparatingWord(ab, abStar).asList());
    Assertions.assertNull(FiniteAutomata.findSeparatingWord(abStar, regex(Regex.star(Regex.star(Regex.word('a', 'b'))))));
  }
}
