package uk.ac.ebi.biostudies.index_core.index;

import lombok.Builder;
import uk.ac.ebi.biostudies.index_core.exceptions.QueryErrorCode;

/**
 * Outcome of one document add, delivered once through the completion callback.
 *
 * @param key document key
 * @param docId id assigned to the document, 0 if none was assigned
 * @param code status code, {@link QueryErrorCode#OK} on success
 * @param detailCode the typed error that caused a failure; equal to {@code code} unless a field
 *     preprocessor failed, in which case {@code code} is {@link QueryErrorCode#GENERIC}
 * @param message error message, null on success
 */
@Builder
public record IndexingResult(
    String key, long docId, QueryErrorCode code, QueryErrorCode detailCode, String message) {

  public static IndexingResult success(String key, long docId) {
    return new IndexingResult(key, docId, QueryErrorCode.OK, QueryErrorCode.OK, null);
  }

  public boolean isSuccess() {
    return code == QueryErrorCode.OK;
  }

  public boolean hasErrors() {
    return !isSuccess();
  }
}
