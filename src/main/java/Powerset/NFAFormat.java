package Powerset;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

import Powerset.Model.EpsilonNFA;
import net.automatalib.exception.FormatException;

/**
 * Reader for the textual NFA descriptions produced by the upstream form and diagram extraction.
 * <p>
 * Two layouts are accepted. The labelled one has one field per line:
 * <pre>
 * Enter number of states: 3
 * Enter states: A B C
 * Enter number of symbols: 2
 * Enter symbols (separate by space): 0 1
 * Enter start state: A
 * Enter number of accepting states: 1
 * Enter accepting states: C
 * Enter number of transitions: 2
 * Enter transition (fromState symbol toState): A 0 B
 * Enter transition (fromState symbol toState): B 1 C
 * </pre>
 * The compact one lists the same values, whitespace separated and without labels.
 * The symbol {@code #} in a transition denotes epsilon.
 */
public class NFAFormat {
    private static final String LABEL_PREFIX = "Enter ";
    private static final Pattern LABELLED_FIELD = Pattern.compile("^\\s*" + LABEL_PREFIX + "[^:\\r\\n]*:", Pattern.MULTILINE);

    public static EpsilonNFA parse(String description) throws FormatException {
        final List<String> tokens = isLabelled(description) ? labelledToTokens(description) : compactTokens(description);
        return fromTokens(tokens.iterator());
    }

    public static EpsilonNFA parse(InputStream is) throws IOException, FormatException {
        return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }

    public static EpsilonNFA parseFile(Path path) throws IOException, FormatException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    /**
     * Write an NFA in the compact layout; {@link #parse(String)} reads it back.
     */
    public static String toCompact(EpsilonNFA nfa) {
        final StringBuilder sb = new StringBuilder();
        sb.append(nfa.size()).append('\n').append(String.join(" ", nfa.getStates())).append('\n');
        sb.append(nfa.getAlphabet().size()).append('\n');
        final List<String> symbols = new ArrayList<>();
        for (Character sym : nfa.getAlphabet()) {
            symbols.add(String.valueOf(sym));
        }
        sb.append(String.join(" ", symbols)).append('\n');
        sb.append(nfa.getStart()).append('\n');
        sb.append(nfa.getAccepting().size()).append('\n').append(String.join(" ", nfa.getAccepting())).append('\n');
        sb.append(nfa.getTransitionCount()).append('\n');
        for (String from : nfa.getStates()) {
            for (Character sym : nfa.getAlphabet()) {
                appendTransitions(sb, nfa, from, sym);
            }
            appendTransitions(sb, nfa, from, EpsilonNFA.EPSILON);
        }
        return sb.toString();
    }

    private static void appendTransitions(StringBuilder sb, EpsilonNFA nfa, String from, char symbol) {
        for (String to : nfa.getTransitions(from, symbol)) {
            sb.append(from).append(' ').append(symbol).append(' ').append(to).append('\n');
        }
    }

    private static boolean isLabelled(String description) {
        return LABELLED_FIELD.matcher(description).find();
    }

    private static List<String> compactTokens(String description) {
        final String stripped = description.strip();
        return stripped.isEmpty() ? List.of() : Arrays.asList(stripped.split("\\s+"));
    }

    /*
    Reorders the labelled fields into the compact layout, checking declared counts on the way.
    Lines that are not fields and unknown fields are skipped; the transition count is taken
    from the non-empty transition lines.
     */
    private static List<String> labelledToTokens(String description) throws FormatException {
        String numStates = null, states = "", numSymbols = null, symbols = "", start = null;
        String numAccepting = null, accepting = "", numTransitions = null;
        final List<String> transitions = new ArrayList<>();

        for (String rawLine : description.split("\\R")) {
            final String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            final int colon = line.indexOf(':');
            if (!line.startsWith(LABEL_PREFIX) || colon < 0) {
                continue; // commentary around the fields
            }
            final String label = line.substring(LABEL_PREFIX.length(), colon).strip();
            final String value = line.substring(colon + 1).strip();

            if (label.equals("number of states")) {
                numStates = value;
            } else if (label.equals("states")) {
                states = value;
            } else if (label.equals("number of symbols")) {
                numSymbols = value;
            } else if (label.startsWith("symbols")) {
                symbols = value;
            } else if (label.equals("start state")) {
                start = value;
            } else if (label.equals("number of accepting states")) {
                numAccepting = value;
            } else if (label.equals("accepting states")) {
                accepting = value;
            } else if (label.equals("number of transitions")) {
                numTransitions = value;
            } else if (label.startsWith("transition")) {
                if (!value.isEmpty()) {
                    transitions.add(value);
                }
            }
        }

        final List<String> tokens = new ArrayList<>();
        addCounted(tokens, numStates, states, "states");
        addCounted(tokens, numSymbols, symbols, "symbols");
        tokens.add(required(start, "start state"));
        addCounted(tokens, numAccepting, accepting, "accepting states");
        required(numTransitions, "number of transitions");
        // empty transition lines were dropped, so the listed lines are authoritative
        tokens.add(String.valueOf(transitions.size()));
        for (String transition : transitions) {
            final List<String> triple = compactTokens(transition);
            if (triple.size() != 3) {
                throw new FormatException("Transition must be 'fromState symbol toState', got: " + transition);
            }
            tokens.addAll(triple);
        }
        return tokens;
    }

    private static void addCounted(List<String> tokens, String count, String values, String field) throws FormatException {
        final List<String> items = compactTokens(values);
        tokens.add(required(count, "number of " + field));
        if (!count.equals(String.valueOf(items.size()))) {
            throw new FormatException("Declared " + count + " " + field + " but listed " + items.size());
        }
        tokens.addAll(items);
    }

    private static String required(String value, String field) throws FormatException {
        if (value == null || value.isEmpty()) {
            throw new FormatException("Missing field: " + field);
        }
        return value;
    }

    private static EpsilonNFA fromTokens(Iterator<String> tokens) throws FormatException {
        final List<String> states = take(tokens, count(tokens, "states"), "states");
        final List<String> symbolTokens = take(tokens, count(tokens, "symbols"), "symbols");
        final List<Character> symbols = new ArrayList<>(symbolTokens.size());
        for (String token : symbolTokens) {
            symbols.add(symbol(token));
        }
        final String start = next(tokens, "start state");
        final List<String> accepting = take(tokens, count(tokens, "accepting states"), "accepting states");

        final EpsilonNFA nfa = new EpsilonNFA(states, symbols, start, accepting);

        final int numTransitions = count(tokens, "transitions");
        for (int i = 0; i < numTransitions; i++) {
            final String from = next(tokens, "transition source");
            final char symbol = symbol(next(tokens, "transition symbol"));
            final String to = next(tokens, "transition target");
            nfa.addTransition(from, symbol, to);
        }
        if (tokens.hasNext()) {
            throw new FormatException("Unexpected trailing input: " + tokens.next());
        }
        return nfa;
    }

    private static int count(Iterator<String> tokens, String field) throws FormatException {
        final String token = next(tokens, "number of " + field);
        try {
            final int count = Integer.parseInt(token);
            if (count < 0) {
                throw new FormatException("Negative number of " + field + ": " + count);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new FormatException("Expected number of " + field + ", got: " + token);
        }
    }

    private static List<String> take(Iterator<String> tokens, int count, String field) throws FormatException {
        final List<String> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(next(tokens, field));
        }
        return result;
    }

    private static String next(Iterator<String> tokens, String field) throws FormatException {
        if (!tokens.hasNext()) {
            throw new FormatException("Unexpected end of input, expected " + field);
        }
        return tokens.next();
    }

    private static char symbol(String token) throws FormatException {
        if (token.length() != 1) {
            throw new FormatException("Symbols must be single characters, got: " + token);
        }
        return token.charAt(0);
    }
}
