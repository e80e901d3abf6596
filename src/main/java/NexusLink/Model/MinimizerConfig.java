package NexusLink.Model;

/**
 * Immutable minimizer settings.
 * @param level minimization level
 * @param enableMetrics whether to collect {@link MinimizationMetrics}
 * @param verbose log refinement progress at info rather than debug level
 * @param maxStates capacity of automatons created by the minimizer
 */
public record MinimizerConfig(MinimizationLevel level, boolean enableMetrics, boolean verbose, int maxStates) {

    public MinimizerConfig {
        if (level == null) {
            throw new IllegalArgumentException("Missing minimization level");
        }
        if (maxStates < 0) {
            throw new IllegalArgumentException("maxStates must not be negative: " + maxStates);
        }
    }

    public static MinimizerConfig defaults() {
        return fromLevel(MinimizationLevel.STANDARD);
    }

    public static MinimizerConfig fromLevel(MinimizationLevel level) {
        return new MinimizerConfig(level, true, false, Automaton.UNBOUNDED);
    }

    public static MinimizerConfig fromLevel(int code) {
        return fromLevel(MinimizationLevel.fromCode(code));
    }

    public MinimizerConfig withLevel(MinimizationLevel level) {
        return new MinimizerConfig(level, enableMetrics, verbose, maxStates);
    }

    public MinimizerConfig withMetrics(boolean enableMetrics) {
        return new MinimizerConfig(level, enableMetrics, verbose, maxStates);
    }

    public MinimizerConfig withVerbose(boolean verbose) {
        return new MinimizerConfig(level, enableMetrics, verbose, maxStates);
    }

    public MinimizerConfig withMaxStates(int maxStates) {
        return new MinimizerConfig(level, enableMetrics, verbose, maxStates);
    }
}
