package uk.ac.ebi.biostudies.index_core.gc;

/** Outcome of a collector cycle as seen by its scheduler. */
public enum GcStatus {
  OK,
  /** The index was dropped or rebuilt since the collector was created. */
  INDEX_INVALID
}
