package NexusLink.Model;

/**
 * How much work the minimizer does. Numeric codes match the {@code --level} command-line option.
 */
public enum MinimizationLevel {
    /** Independent copy, nothing removed. */
    NONE(0, false, false),
    /** Drop states unreachable from the initial state. */
    BASIC(1, true, false),
    /** Merge equivalent states, keep unreachable ones. */
    STANDARD(2, false, true),
    /** Drop unreachable states, then merge equivalent ones. */
    AGGRESSIVE(3, true, true);

    private final int code;
    private final boolean pruneUnreachable;
    private final boolean mergeEquivalent;

    MinimizationLevel(int code, boolean pruneUnreachable, boolean mergeEquivalent) {
        this.code = code;
        this.pruneUnreachable = pruneUnreachable;
        this.mergeEquivalent = mergeEquivalent;
    }

    public int getCode() {
        return code;
    }

    public boolean prunesUnreachable() {
        return pruneUnreachable;
    }

    public boolean mergesEquivalent() {
        return mergeEquivalent;
    }

    public static MinimizationLevel fromCode(int code) {
        for (MinimizationLevel level : values()) {
            if (level.code == code) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown minimization level: " + code);
    }
}
