package NexusLink;

import NexusLink.Model.Automaton;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

public class AutomatonTrimTest {
  @Test
  void testEmpty() {
    Automaton empty = new Automaton();
    Assertions.assertTrue(AutomatonTrim.reachableStates(empty).isEmpty());
    Assertions.assertEquals(0, AutomatonTrim.trim(empty).size());
    Assertions.assertEquals(0, AutomatonTrim.copy(empty, Automaton.UNBOUNDED).size());
  }

  @Test
  void testSmallTrim() {
    Automaton automaton = new Automaton();
    automaton.addState("q0", false);
    automaton.addState("lost", true);
    automaton.addState("q1", true);
    automaton.addState("q2", false);
    automaton.addTransition("q0", "q1", "a");
    automaton.addTransition("q1", "q2", "b");
    automaton.addTransition("q2", "q0", "a");
    automaton.addTransition("lost", "q1", "a");

    BitSet reached = AutomatonTrim.reachableStates(automaton);
    Assertions.assertEquals(3, reached.cardinality());
    Assertions.assertFalse(reached.get(1)); // "lost" isn't reachable

    Automaton trimmed = AutomatonTrim.trim(automaton);
    Assertions.assertEquals(3, trimmed.size());
    Assertions.assertEquals("q0", trimmed.getInitialState().getId());
    Assertions.assertNull(trimmed.findState("lost"));
    Assertions.assertEquals(3, trimmed.getTransitionCount());
    Assertions.assertEquals(trimmed.indexOf("q2"), trimmed.getSuccessor(trimmed.indexOf("q1"), "b"));

    Assertions.assertEquals(4, automaton.size()); // source untouched
  }

  @Test
  void testCopyIsIndependent() {
    Automaton automaton = RandomDFA.partial(7, 6);
    Automaton copy = AutomatonTrim.copy(automaton, Automaton.UNBOUNDED);
    Assertions.assertEquals(RandomDFA.describe(automaton), RandomDFA.describe(copy));
    copy.clear();
    Assertions.assertEquals(6, automaton.size());
  }

  @Test
  void testLongChain() {
    Automaton automaton = new Automaton();
    int length = 100_000;
    for (int i = 0; i < length; i++) {
      automaton.addState("c" + i, i == length - 1);
    }
    automaton.addState("detached", false);
    for (int i = 0; i + 1 < length; i++) {
      automaton.addTransition("c" + i, "c" + (i + 1), "a");
      automaton.addTransition("c" + (i + 1), "c" + i, "b");
    }
    Assertions.assertEquals(length, AutomatonTrim.reachableStates(automaton).cardinality());
    Assertions.assertEquals(length, AutomatonTrim.trim(automaton).size());
  }
}
