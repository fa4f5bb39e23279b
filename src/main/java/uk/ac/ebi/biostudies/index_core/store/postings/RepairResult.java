package uk.ac.ebi.biostudies.index_core.store.postings;

/**
 * Outcome of one bounded repair chunk.
 *
 * @param nextCursor block to resume from; 0 when the structure is fully repaired
 * @param docsRemoved records removed by this chunk
 * @param bytesFreed encoded bytes released by this chunk
 */
public record RepairResult(int nextCursor, long docsRemoved, long bytesFreed) {

  public boolean isFinished() {
    return nextCursor == 0;
  }
}
