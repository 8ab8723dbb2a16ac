package FSM.Model;

/**
 * Thrown when a symbol outside the automaton's alphabet is used, either in a transition
 * declaration or in a word handed to an acceptance query.
 */
public class UnknownSymbolException extends IllegalArgumentException {

    private final transient Object symbol;

    public UnknownSymbolException(Object symbol) {
        super("Symbol not in alphabet: " + symbol);
        this.symbol = symbol;
    }

    public Object getSymbol() {
        return symbol;
    }
}
