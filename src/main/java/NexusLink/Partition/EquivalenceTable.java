package NexusLink.Partition;

import java.util.Arrays;

import NexusLink.Model.Automaton;
import NexusLink.Model.State;
import NexusLink.Model.StateCapacityException;
import NexusLink.Model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table-filling computation of state equivalence.
 * <p>
 * Pair (i, j) starts out equivalent iff both states agree on acceptance. A pass splits every pair that has a
 * symbol defined on only one side, or whose successors on a shared symbol are no longer equivalent. Passes
 * repeat until nothing changes. The table is owned by this instance and is dropped with it.
 */
public class EquivalenceTable {
    private static final Logger LOGGER = LoggerFactory.getLogger(EquivalenceTable.class);
    // largest array length the JVM reliably allocates
    private static final long MAX_TABLE_SIZE = Integer.MAX_VALUE - 8;
    /** Largest automaton whose n x n table fits in one array. */
    public static final int MAX_STATES = (int) Math.sqrt((double) MAX_TABLE_SIZE);

    private final Automaton automaton;
    private final int numStates;
    // row-major n x n, kept symmetric
    private final boolean[] table;
    private final boolean verbose;
    private int passes;
    private boolean refined;

    public EquivalenceTable(Automaton automaton) {
        this(automaton, false);
    }

    /**
     * @throws StateCapacityException if the automaton has more than {@link #MAX_STATES} states
     */
    public EquivalenceTable(Automaton automaton, boolean verbose) {
        if ((long) automaton.size() * automaton.size() > MAX_TABLE_SIZE) {
            throw new StateCapacityException(MAX_STATES);
        }
        this.automaton = automaton;
        this.numStates = automaton.size();
        this.verbose = verbose;
        this.table = new boolean[numStates * numStates];
        for (int i = 0; i < numStates; i++) {
            final boolean acc = automaton.isAccepting(i);
            for (int j = 0; j < numStates; j++) {
                table[i * numStates + j] = acc == automaton.isAccepting(j);
            }
        }
    }

    /**
     * Run refinement passes until a fixpoint is reached. Calling this again is a no-op.
     * @return number of passes performed
     */
    public int refine() {
        if (refined) {
            return passes;
        }
        boolean changed;
        do {
            changed = false;
            int splits = 0;
            for (int i = 0; i < numStates; i++) {
                for (int j = i + 1; j < numStates; j++) {
                    if (isEquivalent(i, j) && distinguishable(automaton.getState(i), automaton.getState(j))) {
                        table[i * numStates + j] = false;
                        table[j * numStates + i] = false;
                        splits++;
                        changed = true;
                    }
                }
            }
            passes++;
            log("Refinement pass {}: {} pairs split", passes, splits);
        } while (changed);
        refined = true;
        return passes;
    }

    public boolean isEquivalent(int s1, int s2) {
        return table[s1 * numStates + s2];
    }

    /**
     * Both directions are checked: a symbol defined on only one of the two states separates them.
     */
    private boolean distinguishable(State s1, State s2) {
        for (Transition t : s1.getTransitions()) {
            final int succ2 = s2.getSuccessor(t.symbol());
            if (succ2 == Automaton.MISSING_STATE || !isEquivalent(t.target(), succ2)) {
                return true;
            }
        }
        for (Transition t : s2.getTransitions()) {
            if (!s1.hasTransition(t.symbol())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Assign blocks by scanning states in insertion order: each state not yet assigned opens a new block and
     * pulls in every later state equivalent to it. Refines first if needed.
     */
    public Partition toPartition() {
        refine();
        final int[] blockOf = new int[numStates];
        Arrays.fill(blockOf, -1);
        int blocks = 0;
        for (int i = 0; i < numStates; i++) {
            if (blockOf[i] >= 0) {
                continue;
            }
            final int block = blocks++;
            blockOf[i] = block;
            for (int j = i + 1; j < numStates; j++) {
                if (blockOf[j] < 0 && isEquivalent(i, j)) {
                    blockOf[j] = block;
                }
            }
        }
        log("Partitioned {} states into {} blocks", numStates, blocks);
        return new Partition(blockOf, blocks, passes);
    }

    public static Partition compute(Automaton automaton) {
        return new EquivalenceTable(automaton).toPartition();
    }

    private void log(String format, Object arg1, Object arg2) {
        if (verbose) {
            LOGGER.info(format, arg1, arg2);
        } else {
            LOGGER.debug(format, arg1, arg2);
        }
    }
}
