package FSA.Model;

import java.util.List;

import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.concept.FiniteRepresentation;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ModelTest {
  @Test
  void testStateLimit() {
    StateLimit limit = StateLimit.of(2);
    Assertions.assertEquals(2, limit.getMaxStates());
    Assertions.assertEquals("2", limit.toString());
    Assertions.assertFalse(limit.isAboveThreshold(2));
    Assertions.assertTrue(limit.isAboveThreshold(3));
    limit.check(2, "determinize");

    StateLimitExceededException e =
        Assertions.assertThrows(StateLimitExceededException.class, () -> limit.check(3, "determinize"));
    Assertions.assertEquals(2, e.getLimit());
    Assertions.assertTrue(e.getMessage().startsWith("determinize"));

    Assertions.assertEquals("unbounded", StateLimit.UNBOUNDED.toString());
    Assertions.assertFalse(StateLimit.UNBOUNDED.isAboveThreshold(Integer.MAX_VALUE));

    Assertions.assertThrows(IllegalArgumentException.class, () -> StateLimit.of(0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> StateLimit.of(-5));
  }

  @Test
  void testExceptions() {
    AutomatonException e = new PreconditionViolationException("complete", "a deterministic automaton");
    Assertions.assertEquals("complete requires a deterministic automaton", e.getMessage());
    Assertions.assertTrue(e instanceof RuntimeException);

    AlphabetMismatchException mismatch = AlphabetMismatchException.of("union", List.of('a', 'b'), List.of('b', 'c'));
    Assertions.assertTrue(mismatch.getMessage().startsWith("union"));
    Assertions.assertTrue(mismatch.getMessage().contains("[a]"));
    Assertions.assertTrue(mismatch.getMessage().contains("[c]"));
  }

  @Test
  void testFiniteRepresentation() {
    AutomatonBuilder<Integer> builder = new AutomatonBuilder<>(Alphabets.integers(0, 1));
    builder.addState(false);
    builder.addState(false);
    FiniteRepresentation fR = builder.build();
    Assertions.assertEquals(2, fR.size());
  }
}
