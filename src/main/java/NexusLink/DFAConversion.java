package NexusLink;

import java.util.Collection;
import java.util.Set;

import NexusLink.Model.Automaton;
import NexusLink.Model.NondeterministicTransitionException;
import NexusLink.Model.State;
import NexusLink.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Bridges between {@link Automaton} and AutomataLib's compact automata.
 */
public class DFAConversion {
    static final String STATE_PREFIX = "s";

    /**
     * Export to a CompactDFA over the automaton's input symbols. State i of the automaton is state i of the DFA;
     * missing transitions stay undefined.
     */
    public static CompactDFA<String> toCompactDFA(Automaton automaton) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(automaton.getInputSymbols());
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, automaton.size());
        for (State s : automaton.getStates()) {
            if (s.getIndex() == automaton.getInitialIndex()) {
                dfa.addInitialState(s.isAccepting());
            } else {
                dfa.addState(s.isAccepting());
            }
        }
        for (State s : automaton.getStates()) {
            for (Transition t : s.getTransitions()) {
                dfa.setTransition(s.getIndex(), alphabet.getSymbolIndex(t.symbol()), t.target());
            }
        }
        return dfa;
    }

    /**
     * Import a CompactNFA that is actually deterministic. State i is named {@code s<i>}; the initial state is
     * added first so that it stays initial.
     * @throws IllegalArgumentException if the NFA does not have exactly one initial state
     * @throws NondeterministicTransitionException if a state has several successors on one symbol
     */
    public static Automaton fromNFA(CompactNFA<String> nfa) {
        final Set<Integer> initialStates = nfa.getInitialStates();
        if (initialStates.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one initial state, found " + initialStates.size());
        }
        final int init = initialStates.iterator().next();
        final int states = nfa.size();
        final Automaton automaton = new Automaton();

        automaton.addState(stateId(init), nfa.isAccepting(init));
        for (int i = 0; i < states; i++) {
            if (i != init) {
                automaton.addState(stateId(i), nfa.isAccepting(i));
            }
        }
        for (int i = 0; i < states; i++) {
            for (String symbol : nfa.getInputAlphabet()) {
                final Collection<Integer> succs = nfa.getTransitions(i, symbol);
                if (succs.size() > 1) {
                    throw new NondeterministicTransitionException(stateId(i), symbol);
                }
                for (int succ : succs) {
                    automaton.addTransition(stateId(i), stateId(succ), symbol);
                }
            }
        }
        return automaton;
    }

    static String stateId(int index) {
        return STATE_PREFIX + index;
    }
}
