package uk.ac.ebi.biostudies.index_core.exceptions;

/** Typed error codes surfaced to callers of the indexing pipeline. */
public enum QueryErrorCode {
  OK("Success"),
  DUPLICATE_FIELD("Duplicate field"),
  UNSUPPORTED_TYPE("Unsupported index type"),
  NOT_NUMERIC("Could not convert value to a number"),
  GEO_FORMAT("Invalid geo string"),
  NO_SUCH_DOCUMENT("Document not found"),
  GENERIC("Generic error evaluating the query");

  private final String defaultMessage;

  QueryErrorCode(String defaultMessage) {
    this.defaultMessage = defaultMessage;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }
}
