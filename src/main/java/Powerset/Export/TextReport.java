package Powerset.Export;

import java.util.Collection;
import java.util.Map;

import Powerset.Model.EpsilonNFA;
import Powerset.SubsetDFA;

/**
 * Plain-text listings of automata, meant for the console.
 */
public class TextReport {

    /**
     * One block per DFA state in index order, e.g.
     * <pre>
     * State q0 {A} [start]:
     *     On symbol '0' -> q1 {A, B}
     * </pre>
     */
    public static String describe(SubsetDFA dfa) {
        final StringBuilder sb = new StringBuilder();
        for (int q = 0; q < dfa.size(); q++) {
            sb.append("State ").append(dfa.stateName(q)).append(' ').append(subsetLabel(dfa.subset(q)));
            if (q == dfa.getInitialState()) {
                sb.append(" [start]");
            }
            if (dfa.isAccepting(q)) {
                sb.append(" [accepting]");
            }
            sb.append(":\n");
            for (Map.Entry<Character, Integer> t : dfa.transitions(q).entrySet()) {
                final int succ = t.getValue();
                sb.append("    On symbol '").append(t.getKey()).append("' -> ")
                    .append(dfa.stateName(succ)).append(' ').append(subsetLabel(dfa.subset(succ))).append('\n');
            }
        }
        return sb.toString();
    }

    public static String describe(EpsilonNFA nfa) {
        final StringBuilder sb = new StringBuilder();
        sb.append("States: ").append(String.join(" ", nfa.getStates())).append('\n');
        sb.append("Symbols:");
        for (Character sym : nfa.getAlphabet()) {
            sb.append(' ').append(sym);
        }
        sb.append('\n');
        sb.append("Start state: ").append(nfa.getStart()).append('\n');
        sb.append("Transitions:\n");
        for (String state : nfa.getStates()) {
            for (Character sym : nfa.getAlphabet()) {
                appendTransition(sb, state, sym, nfa.getTransitions(state, sym));
            }
            appendTransition(sb, state, EpsilonNFA.EPSILON, nfa.getTransitions(state, EpsilonNFA.EPSILON));
        }
        sb.append("Accepting states: ").append(String.join(" ", nfa.getAccepting())).append('\n');
        return sb.toString();
    }

    public static String subsetLabel(Collection<String> states) {
        return "{" + String.join(", ", states) + "}";
    }

    private static void appendTransition(StringBuilder sb, String from, char symbol, Collection<String> to) {
        if (!to.isEmpty()) {
            sb.append("    From state ").append(from).append(" -> ").append(symbol).append(" -> ")
                .append(String.join(" ", to)).append('\n');
        }
    }
}
