package uk.ac.ebi.biostudies.index_core.gc;

import java.util.concurrent.atomic.AtomicLong;

/** Cumulative counters of one collector. */
public class GcStats {

  private final AtomicLong totalCollected = new AtomicLong();
  private final AtomicLong totalRemoved = new AtomicLong();
  private final AtomicLong numCycles = new AtomicLong();
  private final AtomicLong effectiveCycles = new AtomicLong();

  void collected(long records, long bytes) {
    totalRemoved.addAndGet(records);
    totalCollected.addAndGet(bytes);
  }

  void cycleCompleted(boolean effective) {
    numCycles.incrementAndGet();
    if (effective) {
      effectiveCycles.incrementAndGet();
    }
  }

  /** Bytes freed since the collector started. */
  public long getTotalCollected() {
    return totalCollected.get();
  }

  /** Postings records removed since the collector started. */
  public long getTotalRemoved() {
    return totalRemoved.get();
  }

  public long getNumCycles() {
    return numCycles.get();
  }

  public long getEffectiveCycles() {
    return effectiveCycles.get();
  }

  /** Ratio of cycles that freed at least one byte. */
  public double getEffectiveCyclesRate() {
    long cycles = numCycles.get();
    return (double) effectiveCycles.get() / (double) (cycles == 0 ? 1 : cycles);
  }
}
