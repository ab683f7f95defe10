package FSA.Model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Raised when two automata (or a regex and an automaton) are combined over different symbol sets.
 * Missing symbols are never treated as implicit rejection; widen the alphabet explicitly first.
 */
public class AlphabetMismatchException extends AutomatonException {

    public AlphabetMismatchException(String message) {
        super(message);
    }

    public static AlphabetMismatchException of(String operation, Collection<?> left, Collection<?> right) {
        Set<Object> onlyLeft = new LinkedHashSet<>(left);
        onlyLeft.removeAll(right);
        Set<Object> onlyRight = new LinkedHashSet<>(right);
        onlyRight.removeAll(left);
        return new AlphabetMismatchException(operation + ": alphabets differ (only in left operand: " + onlyLeft
                                             + ", only in right operand: " + onlyRight + ")");
    }
}
