package NexusLink.Partition;

import NexusLink.Model.Automaton;
import NexusLink.Model.AutomatonException;
import NexusLink.Model.NondeterministicTransitionException;
import NexusLink.Model.State;
import NexusLink.Model.Transition;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Builds the quotient of an automaton by a partition of its states.
 */
public final class QuotientBuilder {

    private QuotientBuilder() {
    }

    public static Automaton build(Automaton source, Partition partition) {
        return build(source, partition, Automaton.UNBOUNDED);
    }

    /**
     * One state per block, labelled {@link Partition#label(int)}; block 0 holds the source's initial state, so it
     * becomes the quotient's initial state. Each block gets one transition per symbol seen on any member.
     * @param capacity state capacity of the new automaton
     * @throws AutomatonException if a block mixes final and non-final states
     * @throws NondeterministicTransitionException if two members of a block lead to different blocks on one symbol
     */
    public static Automaton build(Automaton source, Partition partition, int capacity) {
        if (partition.numStates() != source.size()) {
            throw new IllegalArgumentException("Partition covers " + partition.numStates()
                + " states, automaton has " + source.size());
        }
        final Automaton quotient = new Automaton(capacity);
        for (int b = 0; b < partition.size(); b++) {
            final IntList members = partition.getMembers(b);
            final boolean accepting = source.isAccepting(members.getInt(0));
            for (int member : members) {
                if (source.isAccepting(member) != accepting) {
                    throw new AutomatonException("Block " + Partition.label(b) + " mixes final and non-final states");
                }
            }
            quotient.addState(Partition.label(b), accepting);
        }

        for (int b = 0; b < partition.size(); b++) {
            final String label = Partition.label(b);
            final State out = quotient.getState(b);
            for (int member : partition.getMembers(b)) {
                for (Transition t : source.getState(member).getTransitions()) {
                    final int targetBlock = partition.getBlock(t.target());
                    final int existing = out.getSuccessor(t.symbol());
                    if (existing == Automaton.MISSING_STATE) {
                        quotient.addTransition(label, Partition.label(targetBlock), t.symbol());
                    } else if (existing != targetBlock) {
                        throw new NondeterministicTransitionException(label, t.symbol());
                    }
                }
            }
        }
        return quotient;
    }
}
