package NexusLink.Model;

/**
 * Raised when a state would get a second transition on the same symbol.
 */
public class NondeterministicTransitionException extends AutomatonException {
    private final String stateId;
    private final String symbol;

    public NondeterministicTransitionException(String stateId, String symbol) {
        super("State " + stateId + " already has a transition on symbol '" + symbol + "'");
        this.stateId = stateId;
        this.symbol = symbol;
    }

    public String getStateId() {
        return stateId;
    }

    public String getSymbol() {
        return symbol;
    }
}
