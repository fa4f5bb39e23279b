package uk.ac.ebi.biostudies.index_core.registry.model;

import java.util.Set;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Describes how a single schema field is indexed. Instances are immutable metadata objects shared
 * between the indexing pipeline and the garbage collector.
 *
 * <p>Each spec has a schema-assigned slot ({@link #getIndex()}) that is unique inside its index and
 * is used to detect a field being supplied twice in one document. Sortable fields also own a slot
 * in the per-document sort vector ({@link #getSortIndex()}), and full-text fields own a field id
 * ({@link #getFtId()}) that is recorded in postings field masks.
 *
 * <p>The {@link #EMPTY} spec stands in for document fields that do not map to any schema field.
 *
 * @see IndexSchema
 */
@Builder(toBuilder = true)
@Getter
@ToString
@EqualsAndHashCode
public class FieldSpec {

  public static final char DEFAULT_TAG_SEPARATOR = ',';

  /** Spec used for document fields that are not part of the schema. */
  public static final FieldSpec EMPTY =
      FieldSpec.builder().name("").types(Set.of()).index(-1).build();

  private final String name;

  /** Types the schema allows this field to be indexed as. */
  private final Set<IndexFieldType> types;

  /** Schema slot of the field. */
  private final int index;

  @Builder.Default private final int sortIndex = -1;

  @Builder.Default private final int ftId = -1;

  @Builder.Default private final double ftWeight = 1.0;

  private final boolean sortable;

  /** Sortable-only field: kept in the sort vector but never written to index structures. */
  private final boolean noIndex;

  private final boolean noStem;

  private final boolean phonetics;

  /** Fields added to a live schema on the fly. They cannot take part in partial updates. */
  private final boolean dynamic;

  @Builder.Default private final char tagSeparator = DEFAULT_TAG_SEPARATOR;

  private final boolean tagCaseSensitive;

  public boolean isEmpty() {
    return name == null || name.isEmpty();
  }

  public boolean isIndexable() {
    return !noIndex;
  }

  public boolean isFieldType(IndexFieldType type) {
    return types != null && types.contains(type);
  }

  /** Returns true if the spec allows exactly one type and it is the given one. */
  public boolean isOnly(IndexFieldType type) {
    return types != null && types.size() == 1 && types.contains(type);
  }
}
