package Powerset;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Queue;

import Powerset.Model.DeterminizeRecord;
import Powerset.Model.EpsilonNFA;
import Powerset.Model.ExplorationLimit;
import Powerset.Model.ExplorationLimitExceededException;
import Powerset.Model.InvalidAutomatonException;
import Powerset.Registry.SubsetRegistry;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Subset construction for NFAs with epsilon transitions.
 */
public class SubsetConstruction {
    public static boolean DEBUG = false;
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    public static SubsetDFA determinize(EpsilonNFA nfa) {
        return determinize(nfa, ExplorationLimit.unbounded());
    }

    /**
     * Breadth-first subset construction.
     * DFA states are named in discovery order; symbols are tried in alphabet order, so identical input
     * always yields identical names and transitions. Empty successor subsets produce no transition.
     * @param nfa - original NFA
     * @param limit - bound on the number of DFA states
     * @return DFA whose state {@code n} is the n-th discovered subset
     * @throws ExplorationLimitExceededException if more subsets are reachable than {@code limit} allows
     */
    public static SubsetDFA determinize(EpsilonNFA nfa, ExplorationLimit limit) {
        final Alphabet<Character> alphabet = nfa.getAlphabet();
        final EpsilonClosure closure = new EpsilonClosure(nfa);
        final BitSet accepting = nfa.acceptingIds();
        final SubsetRegistry registry = new SubsetRegistry();
        final CompactDFA<Character> out = new CompactDFA<>(alphabet);
        final Queue<DeterminizeRecord> queue = new ArrayDeque<>();

        final BitSet init = closure.closure(nfa.getStartId());
        if (init.isEmpty()) {
            throw new InvalidAutomatonException("Epsilon closure of start state " + nfa.getStart() + " is empty");
        }
        final int initOut = out.addInitialState(init.intersects(accepting));
        checkAligned(registry.put(init), initOut);
        queue.add(new DeterminizeRecord(init, initOut));

        long statesExplored = 0;
        while (!queue.isEmpty()) {
            final DeterminizeRecord curr = queue.poll();

            for (Character sym : alphabet) {
                final BitSet succ = closure.successor(curr.subset(), sym);
                if (succ.isEmpty()) {
                    continue;
                }
                int outSucc = registry.get(succ);
                if (outSucc == SubsetRegistry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = out.addState(succ.intersects(accepting));
                    if (limit.test(out)) {
                        throw new ExplorationLimitExceededException(limit.getMaxStates());
                    }
                    checkAligned(registry.put(succ), outSucc);
                    queue.add(new DeterminizeRecord(succ, outSucc));
                }
                out.setTransition(curr.outputAddress(), alphabet.getSymbolIndex(sym), outSucc);
            }
            statesExplored++;

            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " subsets - "
                    + queue.size() + " subsets left in queue - " + out.size() + " DFA states");
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Subset construction finished with " + out.size() + " DFA states");
        }

        return new SubsetDFA(nfa, out, registry);
    }

    private static void checkAligned(int subsetIndex, int dfaState) {
        if (subsetIndex != dfaState) {
            throw new IllegalStateException("Subset index " + subsetIndex + " does not match DFA state " + dfaState);
        }
    }
}
