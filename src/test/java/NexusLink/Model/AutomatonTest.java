package NexusLink.Model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class AutomatonTest {
  @Test
  void testEmpty() {
    Automaton automaton = new Automaton();
    Assertions.assertEquals(0, automaton.size());
    Assertions.assertTrue(automaton.isEmpty());
    Assertions.assertNull(automaton.getInitialState());
    Assertions.assertEquals(Automaton.MISSING_STATE, automaton.getInitialIndex());
    Assertions.assertTrue(automaton.getFinalStates().isEmpty());
    Assertions.assertFalse(automaton.accepts(List.of())); // no initial state
  }

  @Test
  void testFirstStateIsInitial() {
    Automaton automaton = new Automaton();
    automaton.addState("start", false);
    automaton.addState("other", true);
    automaton.addState("third", true);
    Assertions.assertEquals("start", automaton.getInitialState().getId());
    Assertions.assertEquals(0, automaton.getInitialIndex());
    Assertions.assertEquals(List.of("other", "third"),
        automaton.getFinalStates().stream().map(State::getId).toList());
    // insertion order doubles as index
    Assertions.assertEquals(2, automaton.findState("third").getIndex());
    Assertions.assertNull(automaton.findState("missing"));
    Assertions.assertEquals(Automaton.MISSING_STATE, automaton.indexOf("missing"));
  }

  @Test
  void testDuplicateState() {
    Automaton automaton = new Automaton();
    automaton.addState("q0", false);
    DuplicateStateException e = assertThrows(DuplicateStateException.class, () -> automaton.addState("q0", true));
    Assertions.assertEquals("q0", e.getStateId());
    Assertions.assertEquals(1, automaton.size());
    Assertions.assertFalse(automaton.getState(0).isAccepting()); // untouched
  }

  @Test
  void testUnknownTarget() {
    Automaton automaton = new Automaton();
    automaton.addState("q0", false);
    UnknownStateException e =
        assertThrows(UnknownStateException.class, () -> automaton.addTransition("q0", "qX", "a"));
    Assertions.assertEquals("qX", e.getStateId());
    Assertions.assertEquals(0, automaton.findState("q0").getTransitionCount());
    Assertions.assertTrue(automaton.getInputSymbols().isEmpty());

    e = assertThrows(UnknownStateException.class, () -> automaton.addTransition("qY", "q0", "a"));
    Assertions.assertEquals("qY", e.getStateId());
  }

  @Test
  void testDeterminismEnforced() {
    Automaton automaton = new Automaton();
    automaton.addState("q0", false);
    automaton.addState("q1", true);
    automaton.addTransition("q0", "q1", "a");
    NondeterministicTransitionException e = assertThrows(NondeterministicTransitionException.class,
        () -> automaton.addTransition("q0", "q0", "a"));
    Assertions.assertEquals("q0", e.getStateId());
    Assertions.assertEquals("a", e.getSymbol());
    Assertions.assertEquals(1, automaton.findState("q0").getTransitionCount());
    Assertions.assertEquals(1, automaton.getSuccessor(0, "a"));

    // same symbol from another state is fine
    automaton.addTransition("q1", "q1", "a");
    Assertions.assertEquals(2, automaton.getTransitionCount());
  }

  @Test
  void testInvalidArguments() {
    Automaton automaton = new Automaton();
    assertThrows(IllegalArgumentException.class, () -> automaton.addState(null, false));
    assertThrows(IllegalArgumentException.class, () -> automaton.addState("", false));
    automaton.addState("q0", false);
    assertThrows(IllegalArgumentException.class, () -> automaton.addTransition("q0", "q0", null));
    assertThrows(IllegalArgumentException.class, () -> automaton.addTransition("q0", "q0", ""));
    assertThrows(IllegalArgumentException.class, () -> automaton.addTransition(null, "q0", "a"));
    assertThrows(IllegalArgumentException.class, () -> new Automaton(-1));
    Assertions.assertEquals(1, automaton.size());
  }

  @Test
  void testCapacity() {
    Automaton automaton = new Automaton(2);
    automaton.addState("q0", false);
    automaton.addState("q1", false);
    StateCapacityException e = assertThrows(StateCapacityException.class, () -> automaton.addState("q2", true));
    Assertions.assertEquals(2, e.getCapacity());
    Assertions.assertEquals(2, automaton.size());
  }

  @Test
  void testTransitionsAndAccepts() {
    Automaton automaton = new Automaton();
    automaton.addState("q0", false);
    automaton.addState("q1", true);
    automaton.addTransition("q0", "q1", "b");
    automaton.addTransition("q0", "q0", "a");
    automaton.addTransition("q1", "q1", "a");

    State q0 = automaton.findState("q0");
    Assertions.assertEquals(List.of(new Transition("b", 1), new Transition("a", 0)), q0.getTransitions());
    Assertions.assertEquals(List.of("b", "a"), automaton.getInputSymbols());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> q0.getTransitions().clear());

    Assertions.assertTrue(automaton.accepts(List.of("a", "a", "b", "a")));
    Assertions.assertFalse(automaton.accepts(List.of("a")));
    Assertions.assertFalse(automaton.accepts(List.of("b", "b"))); // undefined
    Assertions.assertFalse(automaton.accepts(List.of("c")));
  }

  @Test
  void testClear() {
    Automaton automaton = new Automaton();
    automaton.addState("q0", true);
    automaton.addTransition("q0", "q0", "a");
    State q0 = automaton.getState(0);
    automaton.clear();
    Assertions.assertEquals(0, automaton.size());
    Assertions.assertNull(automaton.getInitialState());
    Assertions.assertEquals(0, q0.getTransitionCount());
    Assertions.assertTrue(automaton.getInputSymbols().isEmpty());
  }
}
