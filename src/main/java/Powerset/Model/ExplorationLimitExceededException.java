package Powerset.Model;

/**
 * Thrown when subset construction discovers more DFA states than the configured {@link ExplorationLimit} allows.
 */
public class ExplorationLimitExceededException extends AutomatonException {
    private final int maxStates;

    public ExplorationLimitExceededException(int maxStates) {
        super("Subset construction exceeded the limit of " + maxStates + " DFA states");
        this.maxStates = maxStates;
    }

    public int getMaxStates() {
        return maxStates;
    }
}
