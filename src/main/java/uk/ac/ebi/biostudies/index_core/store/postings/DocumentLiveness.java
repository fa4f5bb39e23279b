package uk.ac.ebi.biostudies.index_core.store.postings;

/** Tells a repair pass whether a document id still refers to a live document. */
@FunctionalInterface
public interface DocumentLiveness {
  boolean isLive(long docId);
}
