package Powerset.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * NFA over single-character symbols with named states and epsilon transitions.
 * <p>
 * States are numbered by their lexicographic order, so every iteration over states, symbols and
 * successor sets is deterministic. Transitions on real symbols live in an AutomataLib
 * {@link CompactNFA}; epsilon transitions are kept aside, since AutomataLib NFAs have no notion of them.
 */
public class EpsilonNFA {
    public static final char EPSILON = '#';
    private static final int MISSING_STATE = -1;

    private final List<String> stateNames;
    private final Object2IntMap<String> stateIds;
    private final Alphabet<Character> alphabet;
    private final CompactNFA<Character> symbolNFA;
    private final List<IntSortedSet> epsilonTransitions;
    private final BitSet accepting;
    private final int start;
    private int transitionCount;

    public EpsilonNFA(Collection<String> states, Collection<Character> symbols, String start, Collection<String> accepting) {
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(accepting, "accepting");

        final SortedSet<String> sortedStates = new TreeSet<>();
        for (String state : states) {
            if (state == null || state.isBlank()) {
                throw new InvalidAutomatonException("State names must not be blank");
            }
            sortedStates.add(state);
        }
        if (sortedStates.isEmpty()) {
            throw new InvalidAutomatonException("Automaton has no states");
        }
        if (start == null || !sortedStates.contains(start)) {
            throw new InvalidAutomatonException("Start state " + start + " is not a declared state");
        }

        final SortedSet<Character> sortedSymbols = new TreeSet<>();
        for (Character symbol : symbols) {
            Objects.requireNonNull(symbol, "symbol");
            if (symbol == EPSILON) {
                throw new InvalidAutomatonException("Alphabet must not contain the epsilon symbol '" + EPSILON + "'");
            }
            sortedSymbols.add(symbol);
        }

        this.stateNames = List.copyOf(sortedStates);
        this.stateIds = new Object2IntOpenHashMap<>(stateNames.size());
        this.stateIds.defaultReturnValue(MISSING_STATE);
        for (int i = 0; i < stateNames.size(); i++) {
            stateIds.put(stateNames.get(i), i);
        }

        this.accepting = new BitSet(stateNames.size());
        for (String state : accepting) {
            this.accepting.set(requireState(state));
        }

        this.alphabet = Alphabets.fromCollection(sortedSymbols);
        this.symbolNFA = new CompactNFA<>(alphabet, stateNames.size());
        this.epsilonTransitions = new ArrayList<>(stateNames.size());
        for (int i = 0; i < stateNames.size(); i++) {
            symbolNFA.addState(this.accepting.get(i));
            epsilonTransitions.add(new IntRBTreeSet());
        }
        this.start = stateIds.getInt(start);
        symbolNFA.setInitial(Integer.valueOf(this.start), true);
    }

    /**
     * Add {@code to} to the destinations of {@code (from, symbol)}.
     * The epsilon symbol is always accepted; adding an existing transition changes nothing.
     */
    public void addTransition(String from, char symbol, String to) {
        final Integer src = requireState(from);
        final Integer dest = requireState(to);
        final boolean added;
        if (symbol == EPSILON) {
            added = epsilonTransitions.get(src).add(dest.intValue());
        } else {
            final Character input = symbol;
            if (!alphabet.containsSymbol(input)) {
                throw new UnknownSymbolException(symbol);
            }
            added = !symbolNFA.getTransitions(src, input).contains(dest);
            if (added) {
                symbolNFA.addTransition(src, input, dest);
            }
        }
        if (added) {
            transitionCount++;
        }
    }

    public List<String> getStates() {
        return stateNames;
    }

    public Alphabet<Character> getAlphabet() {
        return alphabet;
    }

    public String getStart() {
        return stateNames.get(start);
    }

    public SortedSet<String> getAccepting() {
        return namesOf(accepting);
    }

    public boolean isAccepting(String state) {
        return accepting.get(requireState(state));
    }

    /**
     * @return destinations of {@code (from, symbol)} in lexicographic order; empty if there are none
     */
    public SortedSet<String> getTransitions(String from, char symbol) {
        final Integer src = requireState(from);
        final BitSet dest = new BitSet();
        if (symbol == EPSILON) {
            for (int t : epsilonTransitions.get(src)) {
                dest.set(t);
            }
        } else {
            final Character input = symbol;
            if (!alphabet.containsSymbol(input)) {
                throw new UnknownSymbolException(symbol);
            }
            for (Integer t : symbolNFA.getTransitions(src, input)) {
                dest.set(t);
            }
        }
        return namesOf(dest);
    }

    public int getTransitionCount() {
        return transitionCount;
    }

    public boolean hasEpsilonTransitions() {
        for (IntSortedSet targets : epsilonTransitions) {
            if (!targets.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return stateNames.size();
    }

    public int stateId(String name) {
        return requireState(name);
    }

    public String stateName(int id) {
        return stateNames.get(id);
    }

    public int getStartId() {
        return start;
    }

    public boolean isAcceptingId(int id) {
        return accepting.get(id);
    }

    /**
     * @return accepting states as ids; the returned set is a copy
     */
    public BitSet acceptingIds() {
        return (BitSet) accepting.clone();
    }

    public IntSortedSet epsilonSuccessors(int id) {
        return epsilonTransitions.get(id);
    }

    public Collection<Integer> symbolSuccessors(int id, Character symbol) {
        return symbolNFA.getTransitions(Integer.valueOf(id), symbol);
    }

    /**
     * The non-epsilon part of this automaton as an AutomataLib NFA, state ids matching {@link #stateId(String)}.
     * Only language-equivalent to this automaton if {@link #hasEpsilonTransitions()} is false.
     */
    public CompactNFA<Character> symbolNFA() {
        return symbolNFA;
    }

    /**
     * @return names of the given state ids, in lexicographic order
     */
    public SortedSet<String> namesOf(BitSet ids) {
        final SortedSet<String> result = new TreeSet<>();
        for (int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1)) {
            result.add(stateNames.get(i));
        }
        return Collections.unmodifiableSortedSet(result);
    }

    private int requireState(String name) {
        final int id = name == null ? MISSING_STATE : stateIds.getInt(name);
        if (id == MISSING_STATE) {
            throw new UnknownStateException(name);
        }
        return id;
    }
}
