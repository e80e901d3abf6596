package NexusLink;

import NexusLink.Model.Automaton;
import NexusLink.Model.MinimizationLevel;
import NexusLink.Model.MinimizationMetrics;
import NexusLink.Model.MinimizationResult;
import NexusLink.Model.MinimizerConfig;
import NexusLink.Partition.EquivalenceTable;
import NexusLink.Partition.Partition;
import NexusLink.Partition.QuotientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for building and minimizing automatons.
 * <p>
 * Minimization never touches its input: the result is a new automaton with its own states and transitions,
 * so either one can be cleared or dropped independently.
 */
public final class Minimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Minimizer.class);

    private Minimizer() {
    }

    public static Automaton create() {
        return new Automaton();
    }

    /**
     * Merge equivalent states ({@link MinimizationLevel#STANDARD}); unreachable states are kept.
     * @param automaton automaton to minimize, not modified
     * @return the quotient automaton, or a new empty automaton if the input has no states
     */
    public static Automaton minimize(Automaton automaton) {
        return minimize(automaton, MinimizerConfig.defaults().withMetrics(false)).automaton();
    }

    public static MinimizationResult minimize(Automaton automaton, MinimizerConfig config) {
        if (automaton == null) {
            throw new IllegalArgumentException("Missing automaton");
        }
        if (config == null) {
            throw new IllegalArgumentException("Missing minimizer configuration");
        }
        final long before = System.nanoTime();
        final MinimizationLevel level = config.level();

        final Automaton result;
        int passes = 0;
        if (automaton.isEmpty()) {
            result = new Automaton(config.maxStates());
        } else {
            // only the returned automaton is bound by maxStates
            final int trimCapacity = level.mergesEquivalent() ? Automaton.UNBOUNDED : config.maxStates();
            Automaton source = automaton;
            if (level.prunesUnreachable()) {
                source = AutomatonTrim.trim(automaton, trimCapacity);
                if (source.size() < automaton.size()) {
                    LOGGER.debug("Trimmed to {} reachable states", source.size());
                }
            }
            if (level.mergesEquivalent()) {
                final Partition partition = new EquivalenceTable(source, config.verbose()).toPartition();
                passes = partition.getRefinementPasses();
                result = QuotientBuilder.build(source, partition, config.maxStates());
            } else if (source == automaton) {
                result = AutomatonTrim.copy(automaton, config.maxStates());
            } else {
                result = source;
            }
        }
        final long after = System.nanoTime();

        MinimizationMetrics metrics = null;
        if (config.enableMetrics()) {
            metrics = new MinimizationMetrics(automaton.size(), result.size(), passes,
                (after - before) / 1_000_000d, level);
        }
        if (config.verbose()) {
            LOGGER.info("Minimized {} -> {} states (level {})", automaton.size(), result.size(), level);
        } else {
            LOGGER.debug("Minimized {} -> {} states (level {})", automaton.size(), result.size(), level);
        }
        return new MinimizationResult(result, metrics);
    }

    /**
     * Release the automaton's states and transitions. Null is ignored.
     */
    public static void destroy(Automaton automaton) {
        if (automaton != null) {
            automaton.clear();
        }
    }
}
