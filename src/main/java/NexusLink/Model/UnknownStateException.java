package NexusLink.Model;

public class UnknownStateException extends AutomatonException {
    private final String stateId;

    public UnknownStateException(String stateId) {
        super("Unknown state: " + stateId);
        this.stateId = stateId;
    }

    public String getStateId() {
        return stateId;
    }
}
