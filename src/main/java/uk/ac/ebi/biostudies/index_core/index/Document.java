package uk.ac.ebi.biostudies.index_core.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;

/**
 * A document submitted for indexing: its key, score, optional payload, language and ordered
 * fields. The document id is 0 until the document is committed.
 */
@Getter
@ToString
public class Document {

  private final String key;
  @Setter private long docId;
  @Setter private double score;
  @Setter @ToString.Exclude private byte[] payload;
  @Setter private String language;
  private final List<DocumentField> fields = new ArrayList<>();

  public Document(String key, double score) {
    this(key, score, null);
  }

  public Document(String key, double score, String language) {
    this.key = key;
    this.score = score;
    this.language = language;
  }

  public Document addField(String name, String text) {
    fields.add(new DocumentField(name, text));
    return this;
  }

  public Document addField(String name, String text, Set<IndexFieldType> indexAs) {
    fields.add(new DocumentField(name, text, indexAs));
    return this;
  }

  public List<DocumentField> getFields() {
    return Collections.unmodifiableList(fields);
  }

  public int getNumFields() {
    return fields.size();
  }

  /** Finds a field by name, ignoring case. Returns null if absent. */
  public DocumentField getField(String name) {
    if (name == null) {
      return null;
    }
    for (DocumentField field : fields) {
      if (field.getName().equalsIgnoreCase(name)) {
        return field;
      }
    }
    return null;
  }

  /** Returns the raw field values keyed by name, in field order. Later duplicates win. */
  public Map<String, String> toFieldMap() {
    Map<String, String> map = new LinkedHashMap<>();
    for (DocumentField field : fields) {
      if (field.getText() != null) {
        map.put(field.getName(), field.getText());
      }
    }
    return map;
  }

  /** Returns a copy with the same identity, score, payload, language and fields. */
  public Document copy() {
    Document copy = new Document(key, score, language);
    copy.docId = docId;
    copy.payload = payload == null ? null : payload.clone();
    copy.fields.addAll(fields);
    return copy;
  }

  /** Returns an empty copy of this document: same identity and metadata, no fields. */
  public Document withoutFields() {
    Document copy = copy();
    copy.fields.clear();
    return copy;
  }
}
