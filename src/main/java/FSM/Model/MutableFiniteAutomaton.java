package FSM.Model;

/**
 * Construction interface. Every operation fails fast rather than leaving the automaton inconsistent.
 */
public interface MutableFiniteAutomaton<S, I> extends FiniteAutomaton<S, I> {

    /**
     * @return {@code false} if the state was already present
     */
    default boolean addState(S state) {
        return addState(state, false);
    }

    /**
     * Adds a state. If it is already present nothing changes, its accepting flag included.
     * @return {@code false} if the state was already present
     */
    boolean addState(S state, boolean accepting);

    /**
     * @throws InvalidStateReferenceException if either endpoint is unknown
     * @throws UnknownSymbolException if the symbol is not in the alphabet
     */
    void addTransition(S source, I symbol, S target);

    /**
     * @throws InvalidStateReferenceException if either endpoint is unknown
     */
    void addEpsilonTransition(S source, S target);

    /**
     * @throws InvalidStateReferenceException if the state is unknown
     */
    void setInitial(S state, boolean initial);

    /**
     * @throws InvalidStateReferenceException if the state is unknown
     */
    void setAccepting(S state, boolean accepting);

    /**
     * Adds a transition from {@code state} to itself on every symbol of the alphabet.
     */
    default void addSelfLoops(S state) {
        for (I symbol : getInputAlphabet()) {
            addTransition(state, symbol, state);
        }
    }
}
