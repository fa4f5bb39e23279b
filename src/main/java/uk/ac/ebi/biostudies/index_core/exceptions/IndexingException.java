package uk.ac.ebi.biostudies.index_core.exceptions;

import lombok.Getter;

/**
 * Failure of a single document add. Carries the {@link QueryErrorCode} reported back to the caller
 * through the completion callback.
 */
@Getter
public class IndexingException extends RuntimeException {

  private final QueryErrorCode code;

  public IndexingException(QueryErrorCode code) {
    this(code, code.getDefaultMessage());
  }

  public IndexingException(QueryErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public IndexingException(QueryErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }
}
