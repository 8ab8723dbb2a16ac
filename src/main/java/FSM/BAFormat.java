package FSM;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;

import FSM.Model.CompactFiniteAutomaton;
import FSM.Model.FiniteAutomaton;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

/**
 * Reading and writing the BA format (<a href="https://languageinclusion.org/doku.php?id=tools">RABIT</a>)
 * through AutomataLib's parser and writer.
 */
public class BAFormat {

    /**
     * States are labelled by the ids AutomataLib's parser assigns.
     */
    public static CompactFiniteAutomaton<Integer, String> read(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        return AutomataLibAdapter.fromNFA(automaton, automaton.getInputAlphabet());
    }

    public static <I> void write(FiniteAutomaton<?, I> automaton, OutputStream os) throws IOException {
        final CompactNFA<I> nfa = AutomataLibAdapter.toCompactNFA(automaton);
        new BAWriter<I>().writeModel(os, nfa, nfa.getInputAlphabet());
    }

    static CompactFiniteAutomaton<Integer, String> getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        } catch (FormatException ex) {
            throw new IllegalArgumentException("Malformed BA file " + filePath, ex);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    static void writeBAFile(String filePath, FiniteAutomaton<?, ?> automaton) {
        try (OutputStream os = new FileOutputStream(filePath)) {
            write(automaton, os);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
