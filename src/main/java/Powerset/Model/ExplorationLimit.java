package Powerset.Model;

import java.util.function.Predicate;

import net.automatalib.automaton.concept.FiniteRepresentation;

/**
 * Limits decide when subset construction has explored too many subsets.
 * The test is applied to the DFA under construction; {@code true} means the bound is crossed.
 */
public interface ExplorationLimit extends Predicate<FiniteRepresentation> {
    int UNBOUNDED = Integer.MAX_VALUE;

    String getName();

    /**
     * @return maximal number of DFA states, or {@link #UNBOUNDED}
     */
    int getMaxStates();

    /**
     * maxStates(n): at most n DFA states may be discovered.
     * @param maxStates - upper bound, at least 1 (the initial subset always exists)
     */
    static ExplorationLimit maxStates(int maxStates) {
        if (maxStates < 1) {
            throw new IllegalArgumentException("Limit must allow at least one state: " + maxStates);
        }
        return new ExplorationLimit() {
            @Override
            public boolean test(FiniteRepresentation finiteRepresentation) {
                return finiteRepresentation.size() > maxStates;
            }

            @Override
            public String getName() {
                return "maxStates";
            }

            @Override
            public int getMaxStates() {
                return maxStates;
            }
        };
    }

    static ExplorationLimit unbounded() {
        return new ExplorationLimit() {
            @Override
            public boolean test(FiniteRepresentation finiteRepresentation) {
                return false;
            }

            @Override
            public String getName() {
                return "unbounded";
            }

            @Override
            public int getMaxStates() {
                return UNBOUNDED;
            }
        };
    }
}
