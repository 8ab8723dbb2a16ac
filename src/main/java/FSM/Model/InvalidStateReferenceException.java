package FSM.Model;

/**
 * Thrown when an operation names a state that is not part of the automaton.
 */
public class InvalidStateReferenceException extends IllegalArgumentException {

    private final transient Object state;

    public InvalidStateReferenceException(Object state) {
        super("Unknown state: " + state);
        this.state = state;
    }

    public Object getState() {
        return state;
    }
}
