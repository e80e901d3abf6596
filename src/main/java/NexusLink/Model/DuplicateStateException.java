package NexusLink.Model;

public class DuplicateStateException extends AutomatonException {
    private final String stateId;

    public DuplicateStateException(String stateId) {
        super("State already exists: " + stateId);
        this.stateId = stateId;
    }

    public String getStateId() {
        return stateId;
    }
}
