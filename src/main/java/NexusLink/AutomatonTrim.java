package NexusLink;

import java.util.BitSet;

import NexusLink.Model.Automaton;
import NexusLink.Model.State;
import NexusLink.Model.Transition;
import it.unimi.dsi.fastutil.ints.IntArrayList;

public class AutomatonTrim {
    public static Automaton trim(Automaton automaton) {
        return trim(automaton, Automaton.UNBOUNDED);
    }

    /**
     * Copy of the automaton restricted to the states reachable from its initial state.
     * Ids and insertion order are kept.
     */
    public static Automaton trim(Automaton automaton, int capacity) {
        return restrict(automaton, reachableStates(automaton), capacity);
    }

    public static Automaton copy(Automaton automaton, int capacity) {
        final BitSet all = new BitSet(automaton.size());
        all.set(0, automaton.size());
        return restrict(automaton, all, capacity);
    }

    /**
     * Forward traversal from the initial state.
     * @return indices of reachable states
     */
    public static BitSet reachableStates(Automaton automaton) {
        final BitSet reached = new BitSet(automaton.size());
        final int init = automaton.getInitialIndex();
        if (init == Automaton.MISSING_STATE) {
            return reached;
        }
        final IntArrayList stack = new IntArrayList();
        reached.set(init);
        stack.push(init);
        while (!stack.isEmpty()) {
            final int curr = stack.popInt();
            for (Transition t : automaton.getState(curr).getTransitions()) {
                if (!reached.get(t.target())) {
                    reached.set(t.target());
                    stack.push(t.target());
                }
            }
        }
        return reached;
    }

    private static Automaton restrict(Automaton automaton, BitSet keep, int capacity) {
        final Automaton out = new Automaton(capacity);
        // ascending order keeps the initial state (index 0) first
        for (int i = keep.nextSetBit(0); i >= 0; i = keep.nextSetBit(i + 1)) {
            final State s = automaton.getState(i);
            out.addState(s.getId(), s.isAccepting());
        }
        for (int i = keep.nextSetBit(0); i >= 0; i = keep.nextSetBit(i + 1)) {
            final State s = automaton.getState(i);
            for (Transition t : s.getTransitions()) {
                if (keep.get(t.target())) {
                    out.addTransition(s.getId(), automaton.getState(t.target()).getId(), t.symbol());
                }
            }
        }
        return out;
    }
}
