package uk.ac.ebi.biostudies.index_core.index;

/** Options of a single document add. */
public enum AddOptions {
  /** Replace an existing document with the same key. */
  REPLACE,
  /** Update only the supplied fields of an existing document. Implies {@link #REPLACE}. */
  PARTIAL,
  /** Do not write the fields to the document store. */
  NO_SAVE,
  /** Never hand the add off to the worker pool. */
  NO_BLOCK
}
