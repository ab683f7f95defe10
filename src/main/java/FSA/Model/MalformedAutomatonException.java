package FSA.Model;

/**
 * Raised while building an automaton that would reference a state or symbol it does not own.
 */
public class MalformedAutomatonException extends AutomatonException {

    public MalformedAutomatonException(String message) {
        super(message);
    }

    static MalformedAutomatonException unknownState(int state, int size) {
        return new MalformedAutomatonException("State " + state + " is not in [0, " + size + ")");
    }

    static MalformedAutomatonException unknownSymbol(Object symbol) {
        return new MalformedAutomatonException("Symbol '" + symbol + "' is not part of the alphabet");
    }
}
