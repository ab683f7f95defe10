package FSA;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.StateLimit;
import FSA.Model.StateLimitExceededException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PowersetDeterminizerTest {
  private static final Alphabet<Integer> ALPHABET = Alphabets.integers(0, 1);

  // words whose n-th last letter is 0; the minimal DFA has 2^n states
  private static Automaton<Integer> nthLastIsZero(int n) {
    AutomatonBuilder<Integer> builder = new AutomatonBuilder<>(ALPHABET);
    int init = builder.addInitialState(false);
    builder.addTransition(init, 0, init);
    builder.addTransition(init, 1, init);
    int prev = builder.addState(n == 1);
    builder.addTransition(init, 0, prev);
    for (int i = 2; i <= n; i++) {
      int next = builder.addState(i == n);
      builder.addTransition(prev, 0, next);
      builder.addTransition(prev, 1, next);
      prev = next;
    }
    return builder.build();
  }

  @Test
  void testSubsetConstruction() {
    Automaton<Integer> nfa = nthLastIsZero(3);
    Assertions.assertFalse(nfa.isDeterministic());

    Automaton<Integer> dfa = PowersetDeterminizer.determinize(nfa);
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertEquals(8, dfa.size());
    Assertions.assertTrue(dfa.isComplete()); // the initial state loops, so no subset is empty
    LanguageUtils.assertSameLanguage(nfa, dfa, 7);
  }

  @Test
  void testDeterministicInputReturnedAsIs() {
    Automaton<Character> dfa = PrimitiveAutomata.word(LanguageUtils.AB, LanguageUtils.word("ab"));
    Assertions.assertSame(dfa, PowersetDeterminizer.determinize(dfa));
  }

  @Test
  void testPartialResult() {
    // "ab" with two initial states: not deterministic, and the result has no sink
    AutomatonBuilder<Character> builder = AutomatonBuilder.copyOf(
        PrimitiveAutomata.word(LanguageUtils.AB, LanguageUtils.word("ab")));
    builder.addInitialState(false);
    Automaton<Character> nfa = builder.build();

    Automaton<Character> dfa = PowersetDeterminizer.determinize(nfa);
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertFalse(dfa.isComplete());
    Assertions.assertEquals(3, dfa.size());
    Assertions.assertTrue(dfa.accepts(LanguageUtils.word("ab")));
  }

  @Test
  void testEpsilonClosure() {
    AutomatonBuilder<Integer> builder = new AutomatonBuilder<>(ALPHABET);
    int s0 = builder.addInitialState(false);
    int s1 = builder.addState(false);
    int s2 = builder.addState(true);
    builder.addEpsilonTransition(s0, s1);
    builder.addEpsilonTransition(s1, s2);
    builder.addTransition(s2, 1, s0);
    Automaton<Integer> nfa = builder.build();

    Automaton<Integer> dfa = PowersetDeterminizer.determinize(nfa);
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertFalse(dfa.hasEpsilonTransitions());
    Assertions.assertTrue(dfa.acceptsEmptyWord());
    Assertions.assertEquals(1, dfa.size()); // {0,1,2} loops to itself on 1
    LanguageUtils.assertSameLanguage(nfa, dfa, 5);
  }

  @Test
  void testNoInitialState() {
    AutomatonBuilder<Integer> builder = new AutomatonBuilder<>(ALPHABET);
    builder.addState(true);
    Automaton<Integer> dfa = PowersetDeterminizer.determinize(builder.build());
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertEquals(1, dfa.size()); // the empty subset
    Assertions.assertFalse(dfa.acceptsEmptyWord());
    Assertions.assertEquals(0, dfa.transitionCount());
  }

  @Test
  void testStateLimit() {
    Automaton<Integer> nfa = nthLastIsZero(4);
    PowersetDeterminizer bounded = new PowersetDeterminizer(StateLimit.of(10));
    StateLimitExceededException e =
        Assertions.assertThrows(StateLimitExceededException.class, () -> bounded.apply(nfa));
    Assertions.assertEquals(10, e.getLimit());

    Automaton<Integer> dfa = new PowersetDeterminizer(StateLimit.of(16)).apply(nfa);
    Assertions.assertEquals(16, dfa.size());
  }

  @Test
  void testRandomPreservesLanguage() {
    for (int seed = 0; seed < 50; seed++) {
      Automaton<Integer> nfa = TabakovVardiRandomNFA.getRandomEpsilonAutomaton(seed, 8);
      Automaton<Integer> dfa = PowersetDeterminizer.determinize(nfa);
      Assertions.assertTrue(dfa.isDeterministic());
      LanguageUtils.assertSameLanguage(nfa, dfa, 6);
    }
  }

  @Test
  void testRemoveEpsilons() {
    for (int seed = 0; seed < 30; seed++) {
      Automaton<Integer> nfa = TabakovVardiRandomNFA.getRandomEpsilonAutomaton(seed, 8);
      Automaton<Integer> epsFree = EpsilonRemoval.removeEpsilons(nfa);
      Assertions.assertFalse(epsFree.hasEpsilonTransitions());
      Assertions.assertEquals(nfa.size(), epsFree.size());
      LanguageUtils.assertSameLanguage(nfa, epsFree, 6);
    }
    Automaton<Integer> plain = TabakovVardiRandomNFA.getRandomAutomaton(1, 5);
    Assertions.assertSame(plain, EpsilonRemoval.removeEpsilons(plain));
  }
}
