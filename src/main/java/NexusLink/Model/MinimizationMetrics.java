package NexusLink.Model;

import java.util.Locale;

public record MinimizationMetrics(int originalStates, int minimizedStates, int refinementPasses,
                                  double durationMillis, MinimizationLevel level) {

    /**
     * @return percentage of states removed, 0 for an empty input
     */
    public double stateReduction() {
        if (originalStates == 0) {
            return 0.0;
        }
        return (1.0 - (double) minimizedStates / originalStates) * 100.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "Original states: %d%nMinimized states: %d%nReduction: %.1f%%%nRefinement passes: %d%n"
                + "Processing time: %.2f ms%nLevel: %s",
            originalStates, minimizedStates, stateReduction(), refinementPasses, durationMillis, level);
    }
}
