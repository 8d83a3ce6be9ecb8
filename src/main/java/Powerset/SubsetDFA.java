package Powerset;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

import Powerset.Model.EpsilonNFA;
import Powerset.Registry.SubsetRegistry;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Result of {@link SubsetConstruction}: a (possibly partial) DFA whose states are subsets of NFA states.
 * State {@code n} is named {@code q<n>}; state 0 is the initial state.
 */
public class SubsetDFA {
    public static final int NO_SUCCESSOR = -1;
    private static final String STATE_PREFIX = "q";

    private final EpsilonNFA nfa;
    private final CompactDFA<Character> dfa;
    private final SubsetRegistry registry;

    SubsetDFA(EpsilonNFA nfa, CompactDFA<Character> dfa, SubsetRegistry registry) {
        this.nfa = nfa;
        this.dfa = dfa;
        this.registry = registry;
    }

    public int size() {
        return dfa.size();
    }

    public int getInitialState() {
        return 0;
    }

    public Alphabet<Character> getAlphabet() {
        return dfa.getInputAlphabet();
    }

    public EpsilonNFA getNFA() {
        return nfa;
    }

    public String stateName(int state) {
        checkState(state);
        return STATE_PREFIX + state;
    }

    /**
     * @return NFA states making up the DFA state, in lexicographic order
     */
    public SortedSet<String> subset(int state) {
        checkState(state);
        return nfa.namesOf(registry.subset(state));
    }

    public boolean isAccepting(int state) {
        checkState(state);
        return automaton().isAccepting(Integer.valueOf(state));
    }

    /**
     * @return successor of {@code state} on {@code symbol}, or NO_SUCCESSOR if the transition is undefined
     *     or the symbol is outside the alphabet.
     */
    public int getSuccessor(int state, char symbol) {
        checkState(state);
        final Character input = symbol;
        if (!getAlphabet().containsSymbol(input)) {
            return NO_SUCCESSOR;
        }
        final Integer succ = automaton().getSuccessor(Integer.valueOf(state), input);
        return succ == null ? NO_SUCCESSOR : succ;
    }

    /**
     * @return defined transitions of {@code state}, keyed by symbol in alphabet order
     */
    public SortedMap<Character, Integer> transitions(int state) {
        final SortedMap<Character, Integer> result = new TreeMap<>();
        for (Character sym : getAlphabet()) {
            final int succ = getSuccessor(state, sym);
            if (succ != NO_SUCCESSOR) {
                result.put(sym, succ);
            }
        }
        return Collections.unmodifiableSortedMap(result);
    }

    public int getTransitionCount() {
        int count = 0;
        for (int q = 0; q < size(); q++) {
            count += transitions(q).size();
        }
        return count;
    }

    /**
     * Follow exactly one transition per symbol from the initial state.
     * @return true iff the run is defined for the whole word and ends in an accepting state
     */
    public boolean accepts(CharSequence word) {
        int state = getInitialState();
        for (int k = 0; k < word.length(); k++) {
            state = getSuccessor(state, word.charAt(k));
            if (state == NO_SUCCESSOR) {
                return false;
            }
        }
        return isAccepting(state);
    }

    /**
     * The underlying AutomataLib DFA, state ids matching this object's state indices.
     */
    public DFA<Integer, Character> automaton() {
        return dfa;
    }

    private void checkState(int state) {
        if (state < 0 || state >= dfa.size()) {
            throw new IndexOutOfBoundsException("No DFA state " + state + " (size " + dfa.size() + ")");
        }
    }
}
