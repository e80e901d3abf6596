package NexusLink;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.BitSet;

import NexusLink.Model.Automaton;
import NexusLink.Model.State;
import NexusLink.Model.Transition;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Automatons in the BA text format, read and written through AutomataLib.
 * BA format described here: https://languageinclusion.org/doku.php?id=tools
 */
public class BAFormat {
    private static final Logger LOGGER = LoggerFactory.getLogger(BAFormat.class);

    public static Automaton read(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> nfa = BAParsers.nfa().readModel(is).model;
        return DFAConversion.fromNFA(nfa);
    }

    /**
     * Write the automaton as a BA file.
     * <p>
     * BA lists only the initial state, transitions and final states, so a state that is none of initial, final,
     * source or target of a transition is not written and is missing when the file is read back.
     */
    public static void write(OutputStream os, Automaton automaton) throws IOException {
        final int dropped = unwritableStates(automaton);
        if (dropped > 0) {
            LOGGER.debug("{} isolated states cannot be represented in BA and are not written", dropped);
        }
        final CompactDFA<String> dfa = DFAConversion.toCompactDFA(automaton);
        BAWriter<String> baWriter = new BAWriter<>();
        baWriter.writeModel(os, dfa, dfa.getInputAlphabet());
    }

    /**
     * Number of states that are not initial, not final and have no incoming or outgoing transition.
     */
    static int unwritableStates(Automaton automaton) {
        final BitSet listed = new BitSet(automaton.size());
        if (!automaton.isEmpty()) {
            listed.set(automaton.getInitialIndex());
        }
        for (State s : automaton.getStates()) {
            if (s.isAccepting() || !s.getTransitions().isEmpty()) {
                listed.set(s.getIndex());
            }
            for (Transition t : s.getTransitions()) {
                listed.set(t.target());
            }
        }
        return automaton.size() - listed.cardinality();
    }

    static Automaton readFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        } catch (IOException | FormatException ex) {
            throw new RuntimeException("Cannot read BA file " + filePath, ex);
        }
    }

    static void writeFile(String filePath, Automaton automaton) {
        try (OutputStream os = new FileOutputStream(filePath)) {
            write(os, automaton);
        } catch (IOException e) {
            throw new RuntimeException("Cannot write BA file " + filePath, e);
        }
    }
}
