package Powerset.Registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Append-only index of discovered subsets.
 * Each subset receives the next integer index on first registration and keeps it forever;
 * two subsets share an index iff they are set-equal.
 */
public class SubsetRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<BitSet> subset2Index;
    private final List<BitSet> subsets;

    public SubsetRegistry() {
        this.subset2Index = new Object2IntOpenHashMap<>();
        this.subset2Index.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.subsets = new ArrayList<>();
    }

    /**
     * @param subset set of NFA state ids
     * @return index of the subset or MISSING_ELEMENT if it was never registered.
     */
    public int get(BitSet subset) {
        return subset2Index.getInt(subset);
    }

    /**
     * Register a new subset. The registry keeps its own copy, so later changes to the argument have no effect.
     * @param subset set of NFA state ids, not yet registered
     * @return index assigned to the subset
     */
    public int put(BitSet subset) {
        if (subset2Index.containsKey(subset)) {
            throw new IllegalStateException("Subset already registered: " + subset);
        }
        final BitSet key = (BitSet) subset.clone();
        final int index = subsets.size();
        subsets.add(key);
        subset2Index.put(key, index);
        return index;
    }

    /**
     * @return a copy of the subset registered under the index
     */
    public BitSet subset(int index) {
        return (BitSet) subsets.get(index).clone();
    }

    public int size() {
        return subsets.size();
    }

    @Override
    public String toString() {
        return "SubsetRegistry" + subsets;
    }
}
