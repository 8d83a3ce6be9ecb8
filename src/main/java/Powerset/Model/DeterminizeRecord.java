package Powerset.Model;

import java.util.BitSet;

/**
 * Worklist entry of subset construction: a subset of NFA state ids and the DFA state it became.
 */
public record DeterminizeRecord(BitSet subset, int outputAddress) {

  @Override
  public String toString() {
    return outputAddress + ": " + subset;
  }
}
