package FSM;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import FSM.Model.FiniteAutomaton;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;

/**
 * Renders an automaton in the DOT language. Nodes are named {@code q<id>} and carry the state label;
 * parallel transitions between two states are merged into one edge with a comma-separated label.
 * The automaton is only read.
 */
public class DotWriter {
    static final String EPSILON = "ε";

    public static void write(FiniteAutomaton<?, ?> automaton, Appendable out) throws IOException {
        out.append("digraph finite_state_machine {\n");
        out.append("\trankdir=LR;\n");
        out.append("\tsize=\"8,5\"\n\n");

        int initialIndex = 0;
        for (int q = 0; q < automaton.size(); q++) {
            final String shape = automaton.isIntAccepting(q) ? "doublecircle" : "circle";
            out.append("\tnode [shape = ").append(shape)
                .append(", label=\"").append(escape(String.valueOf(automaton.getState(q)))).append("\"] q")
                .append(String.valueOf(q)).append(";\n");
            if (automaton.isIntInitial(q)) {
                out.append("\tnode [shape = point] qi_").append(String.valueOf(initialIndex)).append(";\n");
                out.append("\tqi_").append(String.valueOf(initialIndex)).append(" -> q").append(String.valueOf(q)).append(";\n");
                initialIndex++;
            }
        }

        for (Map.Entry<IntIntPair, List<String>> edge : edges(automaton).entrySet()) {
            out.append("\tq").append(String.valueOf(edge.getKey().leftInt()))
                .append(" -> q").append(String.valueOf(edge.getKey().rightInt()))
                .append(" [label=\"").append(escape(String.join(",", edge.getValue()))).append("\"];\n");
        }
        out.append("}\n");
    }

    public static String toDot(FiniteAutomaton<?, ?> automaton) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(automaton, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    private static <I> Map<IntIntPair, List<String>> edges(FiniteAutomaton<?, I> automaton) {
        final int symbols = automaton.getInputAlphabet().size();
        final Map<IntIntPair, List<String>> edges = new LinkedHashMap<>();
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < symbols; a++) {
                final String symbol = String.valueOf(automaton.getInputAlphabet().getSymbol(a));
                for (int t : automaton.getIntSuccessors(q, a)) {
                    edges.computeIfAbsent(new IntIntImmutablePair(q, t), k -> new ArrayList<>()).add(symbol);
                }
            }
            for (int t : automaton.getIntEpsilonSuccessors(q)) {
                edges.computeIfAbsent(new IntIntImmutablePair(q, t), k -> new ArrayList<>()).add(EPSILON);
            }
        }
        return edges;
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
