package NexusLink.Partition;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Equivalence classes ("blocks") of the states of one automaton.
 * Blocks are numbered in the order their first member appears in the automaton.
 */
public final class Partition {
    private final int[] blockOf;
    private final IntList[] members;
    private final int refinementPasses;

    Partition(int[] blockOf, int blockCount, int refinementPasses) {
        this.blockOf = blockOf;
        this.refinementPasses = refinementPasses;
        this.members = new IntList[blockCount];
        for (int b = 0; b < blockCount; b++) {
            members[b] = new IntArrayList();
        }
        for (int s = 0; s < blockOf.length; s++) {
            members[blockOf[s]].add(s);
        }
    }

    /**
     * @return number of blocks
     */
    public int size() {
        return members.length;
    }

    public int numStates() {
        return blockOf.length;
    }

    public int getBlock(int state) {
        return blockOf[state];
    }

    /**
     * @return member state indices of the block, ascending
     */
    public IntList getMembers(int block) {
        return IntLists.unmodifiable(members[block]);
    }

    public boolean sameBlock(int s1, int s2) {
        return blockOf[s1] == blockOf[s2];
    }

    /**
     * Label given to the block's state in a quotient automaton.
     */
    public static String label(int block) {
        return "q" + block;
    }

    /**
     * Number of full table passes needed to reach the fixpoint.
     */
    public int getRefinementPasses() {
        return refinementPasses;
    }

    @Override
    public String toString() {
        return Arrays.toString(members);
    }
}
