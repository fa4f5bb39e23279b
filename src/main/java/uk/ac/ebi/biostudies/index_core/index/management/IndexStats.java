package uk.ac.ebi.biostudies.index_core.index.management;

import java.util.concurrent.atomic.AtomicLong;

/** Live counters of one index, updated by the indexing pipeline and the garbage collector. */
public class IndexStats {

  private final AtomicLong numDocuments = new AtomicLong();
  private final AtomicLong numTerms = new AtomicLong();
  private final AtomicLong numRecords = new AtomicLong();
  private final AtomicLong invertedSize = new AtomicLong();

  public void documentAdded() {
    numDocuments.incrementAndGet();
  }

  public void documentRemoved() {
    numDocuments.decrementAndGet();
  }

  public void termAdded() {
    numTerms.incrementAndGet();
  }

  /** Accounts for records written to postings. */
  public void recordsAdded(long records, long bytes) {
    numRecords.addAndGet(records);
    invertedSize.addAndGet(bytes);
  }

  /** Accounts for records reclaimed from postings. */
  public void recordsRemoved(long records, long bytes) {
    numRecords.addAndGet(-records);
    invertedSize.addAndGet(-bytes);
  }

  public long getNumDocuments() {
    return numDocuments.get();
  }

  public long getNumTerms() {
    return numTerms.get();
  }

  public long getNumRecords() {
    return numRecords.get();
  }

  public long getInvertedSize() {
    return invertedSize.get();
  }
}
