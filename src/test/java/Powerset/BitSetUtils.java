package Powerset;

import Powerset.Model.EpsilonNFA;

import java.util.BitSet;
import java.util.Collection;

public class BitSetUtils {
    // Only for tests
    public static BitSet convertListToBitSet(Collection<Integer> list) {
        BitSet b = new BitSet();
        for(int i: list) {
            b.set(i);
        }
        return b;
    }

    public static BitSet stateIds(EpsilonNFA nfa, Collection<String> names) {
        BitSet b = new BitSet(nfa.size());
        for(String name: names) {
            b.set(nfa.stateId(name));
        }
        return b;
    }
}
