package uk.ac.ebi.biostudies.index_core.gc;

/**
 * Progress of one sub-collector, or of a whole cycle once combined with {@link #plus}.
 *
 * @param docsRemoved postings records removed
 * @param bytesFreed bytes freed
 * @param status {@link GcStatus#INDEX_INVALID} if the index went away during the sweep
 */
public record SweepResult(long docsRemoved, long bytesFreed, GcStatus status) {

  private static final SweepResult EMPTY = new SweepResult(0, 0, GcStatus.OK);
  private static final SweepResult INVALID = new SweepResult(0, 0, GcStatus.INDEX_INVALID);

  public static SweepResult empty() {
    return EMPTY;
  }

  public static SweepResult invalid() {
    return INVALID;
  }

  public SweepResult plus(SweepResult other) {
    GcStatus combined =
        status == GcStatus.INDEX_INVALID || other.status == GcStatus.INDEX_INVALID
            ? GcStatus.INDEX_INVALID
            : GcStatus.OK;
    return new SweepResult(
        docsRemoved + other.docsRemoved, bytesFreed + other.bytesFreed, combined);
  }

  public boolean isValid() {
    return status == GcStatus.OK;
  }
}
