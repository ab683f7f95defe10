package FSA;

import FSA.Model.Automaton;
import FSA.Model.PreconditionViolationException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AutomataLibConverterTest {
  private static final Alphabet<Integer> ALPHABET = Alphabets.integers(0, 1);

  @Test
  void testToCompactNFA() {
    CompactNFA<Integer> myNfa = new CompactNFA<>(ALPHABET);
    int s0 = myNfa.addInitialState(false);
    int s1 = myNfa.addState(true);
    myNfa.addTransition(s0, 0, s0);
    myNfa.addTransition(s0, 0, s1);
    myNfa.addTransition(s1, 1, s0);

    Automaton<Integer> imported = AutomataLibConverter.fromNFA(myNfa, ALPHABET);
    Assertions.assertEquals(2, imported.size());
    Assertions.assertEquals(3, imported.transitionCount());
    Assertions.assertTrue(imported.isInitial(s0));
    Assertions.assertTrue(imported.isAccepting(s1));

    CompactNFA<Integer> exported = AutomataLibConverter.toCompactNFA(imported);
    Assertions.assertEquals(2, exported.size());
    Assertions.assertEquals(1, exported.getInitialStates().size());
    Assertions.assertEquals(2, exported.getTransitions(s0, 0).size());
    Assertions.assertTrue(exported.isAccepting(s1));
  }

  @Test
  void testEpsilonsRemovedOnExport() {
    Automaton<Integer> nfa = TabakovVardiRandomNFA.getRandomEpsilonAutomaton(11, 6);
    Assertions.assertTrue(nfa.hasEpsilonTransitions());
    CompactNFA<Integer> exported = AutomataLibConverter.toCompactNFA(nfa);
    Automaton<Integer> roundTrip = AutomataLibConverter.fromNFA(exported, ALPHABET);
    LanguageUtils.assertSameLanguage(nfa, roundTrip, 6);
  }

  @Test
  void testToCompactDFA() {
    Automaton<Integer> dfa = Minimizer.minimize(TabakovVardiRandomNFA.getRandomAutomaton(5, 8));
    CompactDFA<Integer> exported = AutomataLibConverter.toCompactDFA(dfa);
    Assertions.assertEquals(dfa.size(), exported.size());
    Assertions.assertEquals(Integer.valueOf(dfa.getInitialState()), exported.getInitialState());

    Automaton<Integer> imported = AutomataLibConverter.fromDFA(exported, ALPHABET);
    Assertions.assertTrue(imported.isDeterministic());
    Assertions.assertTrue(Equivalence.identical(dfa, imported));

    Automaton<Integer> nfa = TabakovVardiRandomNFA.getRandomAutomaton(5, 8);
    if (!nfa.isDeterministic()) {
      Assertions.assertThrows(PreconditionViolationException.class, () -> AutomataLibConverter.toCompactDFA(nfa));
    }
  }

  @Test
  void testFromEmptyDFA() {
    CompactDFA<Integer> myDFA = new CompactDFA<>(ALPHABET);
    myDFA.addState(true);
    Automaton<Integer> imported = AutomataLibConverter.fromDFA(myDFA, ALPHABET);
    Assertions.assertEquals(1, imported.size());
    Assertions.assertTrue(imported.getInitialStates().isEmpty());
    Assertions.assertTrue(Equivalence.isEmpty(imported));
  }

  @Test
  void testAgreesWithAutomataLibDeterminization() {
    // both sides complete, so undefined transitions never have to be compared
    for (int seed = 0; seed < 30; seed++) {
      Automaton<Integer> nfa = TabakovVardiRandomNFA.getRandomAutomaton(seed, 8);
      CompactDFA<Integer> expected = NFAs.determinize(AutomataLibConverter.toCompactNFA(nfa), ALPHABET);
      CompactDFA<Integer> actual = AutomataLibConverter.toCompactDFA(Completion.toCompleteDFA(nfa));
      Assertions.assertTrue(Automata.testEquivalence(expected, actual, ALPHABET));
    }
  }
}
