package Powerset.Registry;

import Powerset.BitSetUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class SubsetRegistryTest {
  @Test
  void testSubsetRegistry() {
    SubsetRegistry registry = new SubsetRegistry();
    Assertions.assertEquals(SubsetRegistry.MISSING_ELEMENT, registry.get(new BitSet()));
    Assertions.assertEquals(0, registry.size());

    BitSet b = BitSetUtils.convertListToBitSet(List.of(1,2,3));
    Assertions.assertEquals(0, registry.put(b));
    Assertions.assertEquals(0, registry.get(b));

    BitSet c = BitSetUtils.convertListToBitSet(List.of(1));
    Assertions.assertEquals(1, registry.put(c));
    Assertions.assertEquals(1, registry.get(BitSetUtils.convertListToBitSet(List.of(1))));
    Assertions.assertEquals(2, registry.size());

    // overlapping, but not equal
    Assertions.assertEquals(SubsetRegistry.MISSING_ELEMENT, registry.get(BitSetUtils.convertListToBitSet(List.of(1,2))));
    assertThrows(IllegalStateException.class, () -> registry.put(BitSetUtils.convertListToBitSet(List.of(3,2,1))));
  }

  @Test
  void testKeysAreCopied() {
    SubsetRegistry registry = new SubsetRegistry();
    BitSet b = BitSetUtils.convertListToBitSet(List.of(0,4));
    registry.put(b);
    b.set(7);
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(0,4)), registry.subset(0));
    Assertions.assertEquals(0, registry.get(BitSetUtils.convertListToBitSet(List.of(0,4))));
    Assertions.assertEquals(SubsetRegistry.MISSING_ELEMENT, registry.get(b));
  }

  @Test
  void testReturnedSubsetIsDetached() {
    SubsetRegistry registry = new SubsetRegistry();
    BitSet b = BitSetUtils.convertListToBitSet(List.of(1,3));
    registry.put(b);
    registry.subset(0).set(5);
    registry.subset(0).clear();
    Assertions.assertEquals(b, registry.subset(0));
    Assertions.assertEquals(0, registry.get(b));
    Assertions.assertEquals(1, registry.put(BitSetUtils.convertListToBitSet(List.of(1,3,5))));
  }
}
