package uk.ac.ebi.biostudies.index_core.index;

import java.util.Arrays;
import lombok.Getter;

/** Occurrences of one term in the document being indexed. */
@Getter
public class ForwardIndexEntry {

  private final String term;
  private int freq;
  private long fieldMask;
  private double weight;
  private int[] positions = new int[4];
  private int numPositions;

  ForwardIndexEntry(String term) {
    this.term = term;
  }

  void add(int ftId, double fieldWeight, int position) {
    freq++;
    weight += fieldWeight;
    if (ftId >= 0) {
      fieldMask |= 1L << ftId;
    }
    if (numPositions > 0 && positions[numPositions - 1] == position) {
      return;
    }
    if (numPositions == positions.length) {
      positions = Arrays.copyOf(positions, positions.length * 2);
    }
    positions[numPositions++] = position;
  }

  public int[] getPositions() {
    return Arrays.copyOf(positions, numPositions);
  }
}
