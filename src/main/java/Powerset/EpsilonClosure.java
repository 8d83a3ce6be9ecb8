package Powerset;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.SortedSet;

import Powerset.Model.EpsilonNFA;

/**
 * Epsilon closures over an {@link EpsilonNFA}.
 * Closures of single states are cached, so the automaton must not gain transitions while an instance is in use.
 */
public class EpsilonClosure {
    private final EpsilonNFA nfa;
    private final BitSet[] cache;

    public EpsilonClosure(EpsilonNFA nfa) {
        this.nfa = nfa;
        this.cache = new BitSet[nfa.size()];
    }

    /**
     * @param state - state name
     * @return states reachable from {@code state} by zero or more epsilon transitions, in lexicographic order
     */
    public SortedSet<String> closure(String state) {
        return nfa.namesOf(closure(nfa.stateId(state)));
    }

    /**
     * Closure of a single state, by iterative depth-first traversal.
     * A state is pushed only the first time it is seen, which keeps epsilon cycles finite.
     * @param state - state id
     * @return closure as a fresh set of state ids, always containing {@code state}
     */
    public BitSet closure(int state) {
        BitSet closure = cache[state];
        if (closure == null) {
            closure = new BitSet(nfa.size());
            final Deque<Integer> stack = new ArrayDeque<>();
            closure.set(state);
            stack.push(state);
            while (!stack.isEmpty()) {
                final int current = stack.pop();
                for (int next : nfa.epsilonSuccessors(current)) {
                    if (!closure.get(next)) {
                        closure.set(next);
                        stack.push(next);
                    }
                }
            }
            cache[state] = closure;
        }
        return (BitSet) closure.clone();
    }

    /**
     * @param states - state ids
     * @return union of the closures of all {@code states}
     */
    public BitSet closure(BitSet states) {
        final BitSet result = new BitSet(nfa.size());
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            if (!result.get(i)) {
                result.or(closure(i));
            }
        }
        return result;
    }

    /**
     * States reached from any member of {@code states} by one {@code symbol} transition, then closed under epsilon.
     * @param states - state ids
     * @param symbol - alphabet symbol
     * @return successor subset, empty if no member has a {@code symbol} transition
     */
    public BitSet successor(BitSet states, Character symbol) {
        final BitSet moved = new BitSet(nfa.size());
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            for (Integer t : nfa.symbolSuccessors(i, symbol)) {
                moved.set(t);
            }
        }
        return closure(moved);
    }

    /**
     * Run the NFA directly on {@code word}, tracking the set of active states.
     * @return true iff some run, epsilon moves included, ends in an accepting state
     */
    public boolean accepts(CharSequence word) {
        BitSet current = closure(nfa.getStartId());
        for (int k = 0; k < word.length() && !current.isEmpty(); k++) {
            final Character symbol = word.charAt(k);
            if (!nfa.getAlphabet().containsSymbol(symbol)) {
                return false;
            }
            current = successor(current, symbol);
        }
        return current.intersects(nfa.acceptingIds());
    }
}
