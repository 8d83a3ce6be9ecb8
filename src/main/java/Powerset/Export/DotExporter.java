package Powerset.Export;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import Powerset.SubsetDFA;

/**
 * Writes a {@link SubsetDFA} as a Graphviz digraph.
 * <p>
 * One node per DFA state, labelled with its NFA subset and drawn as a double circle when accepting;
 * a point-shaped {@code start} node pointing at the initial state; one edge per transition labelled
 * with its symbol. Output order follows state indices, then symbols.
 */
public class DotExporter {
    public static final String GRAPH_NAME = "DFA";
    public static final String START_NODE = "start";
    private static final String INDENT = "    ";

    public static String toDot(SubsetDFA dfa) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(dfa, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringBuilder does not throw
        }
        return sb.toString();
    }

    public static void write(SubsetDFA dfa, Appendable out) throws IOException {
        out.append("digraph ").append(GRAPH_NAME).append(" {\n");
        out.append(INDENT).append("rankdir=LR;\n");

        for (int q = 0; q < dfa.size(); q++) {
            out.append(INDENT).append(dfa.stateName(q))
                .append(" [label=\"").append(escape(TextReport.subsetLabel(dfa.subset(q)))).append('"')
                .append(", shape=").append(dfa.isAccepting(q) ? "doublecircle" : "circle")
                .append("];\n");
        }

        out.append(INDENT).append(START_NODE).append(" [shape=point];\n");
        out.append(INDENT).append(START_NODE).append(" -> ").append(dfa.stateName(dfa.getInitialState())).append(";\n");

        // a DFA has one successor per (state, symbol), the set only guards the output format
        final Set<Edge> added = new HashSet<>();
        for (int q = 0; q < dfa.size(); q++) {
            for (Map.Entry<Character, Integer> t : dfa.transitions(q).entrySet()) {
                final Edge edge = new Edge(q, t.getKey(), t.getValue());
                if (added.add(edge)) {
                    out.append(INDENT).append(dfa.stateName(edge.source()))
                        .append(" -> ").append(dfa.stateName(edge.target()))
                        .append(" [label=\"").append(escape(String.valueOf(edge.symbol()))).append("\"];\n");
                }
            }
        }

        out.append("}\n");
    }

    static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private record Edge(int source, char symbol, int target) { }
}
