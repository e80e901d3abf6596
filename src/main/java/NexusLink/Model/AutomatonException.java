package NexusLink.Model;

/**
 * Base class of all failures raised while building or minimizing an {@link Automaton}.
 */
public class AutomatonException extends RuntimeException {

    public AutomatonException(String message) {
        super(message);
    }
}
