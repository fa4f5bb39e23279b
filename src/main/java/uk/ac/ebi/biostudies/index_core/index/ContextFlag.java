package uk.ac.ebi.biostudies.index_core.index;

/** State flags computed when a document is bound to an {@link AddDocumentContext}. */
public enum ContextFlag {
  /** At least one field is written to an index structure. */
  HAS_INDEXABLES,
  /** Nothing left to do for full-text: the document has no indexable text field. */
  TEXT_INDEXED,
  /** Nothing left to do for other types: every indexable field is full-text only. */
  OTHER_INDEXED,
  HAS_SORTABLES,
  /** No sort vector and no indexable field. */
  EMPTY,
  NO_BLOCK
}
