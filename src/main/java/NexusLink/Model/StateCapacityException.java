package NexusLink.Model;

/**
 * Raised when an automaton is asked to grow beyond its state capacity.
 */
public class StateCapacityException extends AutomatonException {
    private final int capacity;

    public StateCapacityException(int capacity) {
        super("Automaton cannot hold more than " + capacity + " states");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
