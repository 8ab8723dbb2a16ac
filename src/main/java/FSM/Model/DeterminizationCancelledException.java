package FSM.Model;

/**
 * Thrown when a {@link Cancellation} stops a subset construction before its worklist is empty.
 */
public class DeterminizationCancelledException extends IllegalStateException {

    private final String label;
    private final int statesExplored;

    public DeterminizationCancelledException(String label, int statesExplored) {
        super("Determinization cancelled (" + label + ") after " + statesExplored + " states");
        this.label = label;
        this.statesExplored = statesExplored;
    }

    /**
     * @return "TO" if interrupted, "OOM" if the state cap was exceeded
     */
    public String getLabel() {
        return label;
    }

    public int getStatesExplored() {
        return statesExplored;
    }
}
