package uk.ac.ebi.biostudies.index_core.store.document;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.Getter;
import uk.ac.ebi.biostudies.index_core.store.postings.DocumentLiveness;

/**
 * Maps document keys to numeric ids and holds their metadata. Document ids are assigned in
 * increasing order and never reused, so postings can be appended in id order.
 *
 * <p>Not thread-safe: callers hold the owning index's lock.
 */
public class DocumentTable implements DocumentLiveness {

  private final Map<String, DocumentMetadata> byKey = new HashMap<>();
  private final Map<Long, DocumentMetadata> byId = new HashMap<>();
  @Getter private long maxDocId;

  /**
   * Registers a document under a fresh id. If the key already exists, the previous document is
   * marked deleted first.
   *
   * @param key document key
   * @param score document score
   * @param flags initial flags
   * @param payload optional payload (may be null)
   * @return metadata of the new document
   */
  public DocumentMetadata put(String key, double score, Set<DocumentFlag> flags, byte[] payload) {
    delete(key);
    DocumentMetadata md = new DocumentMetadata(++maxDocId, key, score);
    md.getFlags().addAll(flags);
    if (payload != null) {
      md.setPayload(payload);
      md.getFlags().add(DocumentFlag.HAS_PAYLOAD);
    }
    byKey.put(key, md);
    byId.put(md.getId(), md);
    return md;
  }

  /** Returns the id of a live document, or 0 if the key is unknown. */
  public long getId(String key) {
    DocumentMetadata md = byKey.get(key);
    return md == null ? 0 : md.getId();
  }

  /** Returns the metadata of a live document, or null. */
  public DocumentMetadata get(long docId) {
    return byId.get(docId);
  }

  public DocumentMetadata getByKey(String key) {
    return byKey.get(key);
  }

  public boolean exists(String key) {
    return byKey.containsKey(key);
  }

  @Override
  public boolean isLive(long docId) {
    return byId.containsKey(docId);
  }

  public void setPayload(long docId, byte[] payload) {
    DocumentMetadata md = byId.get(docId);
    if (md != null) {
      md.setPayload(payload);
      md.getFlags().add(DocumentFlag.HAS_PAYLOAD);
    }
  }

  /**
   * Marks a document deleted and forgets it. Its postings stay in place until collected.
   *
   * @param key document key
   * @return the metadata of the deleted document, or null if the key was unknown
   */
  public DocumentMetadata delete(String key) {
    DocumentMetadata md = byKey.remove(key);
    if (md == null) {
      return null;
    }
    byId.remove(md.getId());
    md.getFlags().add(DocumentFlag.DELETED);
    return md;
  }

  public void forEachKey(Consumer<String> action) {
    byKey.keySet().forEach(action);
  }

  public int size() {
    return byKey.size();
  }
}
