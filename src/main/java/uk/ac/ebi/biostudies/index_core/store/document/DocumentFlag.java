package uk.ac.ebi.biostudies.index_core.store.document;

public enum DocumentFlag {
  /** The document was deleted or replaced; its postings are garbage. */
  DELETED,
  /** The document has entries (geo points) that are removed eagerly on delete. */
  HAS_ON_DEMAND_DELETABLE,
  HAS_PAYLOAD,
  HAS_SORT_VECTOR,
  HAS_OFFSET_VECTOR
}
