package NexusLink.Model;

/**
 * @param automaton minimized automaton, owned by the caller
 * @param metrics collected metrics, or null if disabled
 */
public record MinimizationResult(Automaton automaton, MinimizationMetrics metrics) { }
