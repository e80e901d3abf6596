package NexusLink.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * A deterministic finite automaton over string symbols.
 * <p>
 * States live in an arena and are addressed by stable integer indices, in insertion order. The first state ever
 * added is the initial state. States and transitions can only be appended; {@link #clear()} releases everything.
 * <p>
 * Instances are not synchronized. Concurrent readers are fine as long as nobody mutates the automaton meanwhile.
 */
public class Automaton {
    public static final int MISSING_STATE = -1;
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final List<State> states;
    private final Object2IntMap<String> stateIndex;
    private final Set<String> inputSymbols;
    private final int capacity;
    private int initialState = MISSING_STATE;

    public Automaton() {
        this(UNBOUNDED);
    }

    /**
     * @param capacity maximum number of states this automaton may hold
     */
    public Automaton(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.states = new ArrayList<>();
        this.stateIndex = new Object2IntOpenHashMap<>();
        this.stateIndex.defaultReturnValue(MISSING_STATE);
        this.inputSymbols = new LinkedHashSet<>();
    }

    /**
     * Add a new state. The first state added becomes the initial state.
     * @param id unique identifier
     * @param accepting whether the state is final
     * @return the new state
     * @throws DuplicateStateException if a state with this id already exists
     * @throws StateCapacityException if the automaton is full
     */
    public State addState(String id, boolean accepting) {
        requireNonEmpty(id, "state id");
        if (stateIndex.containsKey(id)) {
            throw new DuplicateStateException(id);
        }
        if (states.size() >= capacity) {
            throw new StateCapacityException(capacity);
        }
        final State state = new State(id, states.size(), accepting);
        states.add(state);
        stateIndex.put(id, state.getIndex());
        if (initialState == MISSING_STATE) {
            initialState = state.getIndex();
        }
        return state;
    }

    /**
     * Add a transition {@code from --symbol--> to}. Nothing is changed if this throws.
     * @throws UnknownStateException if either state does not exist
     * @throws NondeterministicTransitionException if {@code from} already has a transition on symbol
     */
    public void addTransition(String fromId, String toId, String symbol) {
        requireNonEmpty(fromId, "source state id");
        requireNonEmpty(toId, "target state id");
        requireNonEmpty(symbol, "symbol");
        final State from = findState(fromId);
        if (from == null) {
            throw new UnknownStateException(fromId);
        }
        final State to = findState(toId);
        if (to == null) {
            throw new UnknownStateException(toId);
        }
        if (from.hasTransition(symbol)) {
            throw new NondeterministicTransitionException(fromId, symbol);
        }
        from.addTransition(symbol, to.getIndex());
        inputSymbols.add(symbol);
    }

    /**
     * @return the state with this id, or null if absent
     */
    public State findState(String id) {
        final int index = indexOf(id);
        return index == MISSING_STATE ? null : states.get(index);
    }

    public int indexOf(String id) {
        return stateIndex.getInt(id);
    }

    public State getState(int index) {
        return states.get(index);
    }

    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    public int size() {
        return states.size();
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return the initial state, or null if the automaton is empty
     */
    public State getInitialState() {
        return initialState == MISSING_STATE ? null : states.get(initialState);
    }

    public int getInitialIndex() {
        return initialState;
    }

    /**
     * Final states in insertion order. This is a snapshot derived from the states' flags.
     */
    public List<State> getFinalStates() {
        final List<State> result = new ArrayList<>();
        for (State s : states) {
            if (s.isAccepting()) {
                result.add(s);
            }
        }
        return result;
    }

    public boolean isAccepting(int index) {
        return states.get(index).isAccepting();
    }

    public int getSuccessor(int index, String symbol) {
        return states.get(index).getSuccessor(symbol);
    }

    /**
     * Symbols used by any transition, in the order they first appeared.
     */
    public List<String> getInputSymbols() {
        return new ArrayList<>(inputSymbols);
    }

    public int getTransitionCount() {
        int count = 0;
        for (State s : states) {
            count += s.getTransitionCount();
        }
        return count;
    }

    /**
     * Run the automaton from its initial state. A missing transition rejects.
     */
    public boolean accepts(Iterable<String> word) {
        int current = initialState;
        if (current == MISSING_STATE) {
            return false;
        }
        for (String symbol : word) {
            current = getSuccessor(current, symbol);
            if (current == MISSING_STATE) {
                return false;
            }
        }
        return isAccepting(current);
    }

    /**
     * Release all states and transitions. The automaton is empty afterwards.
     */
    public void clear() {
        for (State s : states) {
            s.release();
        }
        states.clear();
        stateIndex.clear();
        inputSymbols.clear();
        initialState = MISSING_STATE;
    }

    private static void requireNonEmpty(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Missing " + name);
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("Automaton[").append(states.size()).append(" states]");
        for (State s : states) {
            sb.append(System.lineSeparator()).append("  ").append(s);
        }
        return sb.toString();
    }
}
