package NexusLink.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * A state of an {@link Automaton}. States are only created through {@link Automaton#addState(String, boolean)}
 * and are addressed by their stable index in the owning automaton.
 */
public final class State {
    private final String id;
    private final int index;
    private final boolean accepting;
    private final List<Transition> transitions;
    // symbol -> target index, for O(1) successor lookup
    private final Object2IntMap<String> successors;

    State(String id, int index, boolean accepting) {
        this.id = id;
        this.index = index;
        this.accepting = accepting;
        this.transitions = new ArrayList<>();
        this.successors = new Object2IntOpenHashMap<>();
        this.successors.defaultReturnValue(Automaton.MISSING_STATE);
    }

    public String getId() {
        return id;
    }

    public int getIndex() {
        return index;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Outgoing transitions in the order they were added.
     */
    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public int getTransitionCount() {
        return transitions.size();
    }

    /**
     * @param symbol input symbol
     * @return target index, or {@link Automaton#MISSING_STATE} if there is no transition on symbol
     */
    public int getSuccessor(String symbol) {
        return successors.getInt(symbol);
    }

    public boolean hasTransition(String symbol) {
        return successors.containsKey(symbol);
    }

    void addTransition(String symbol, int target) {
        transitions.add(new Transition(symbol, target));
        successors.put(symbol, target);
    }

    void release() {
        transitions.clear();
        successors.clear();
    }

    @Override
    public String toString() {
        return (accepting ? "((" + id + "))" : "(" + id + ")") + " " + transitions;
    }
}
