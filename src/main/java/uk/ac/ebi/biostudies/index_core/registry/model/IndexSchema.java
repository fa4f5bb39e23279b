package uk.ac.ebi.biostudies.index_core.registry.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable schema of one index: its name, index-wide options and the ordered list of field specs.
 *
 * <p>Field lookup by name is case-insensitive, mirroring how document fields are matched against
 * the schema.
 *
 * <pre>{@code
 * IndexSchema schema = new IndexSchema("products", List.of(title, price), false);
 * FieldSpec price = schema.getField("PRICE");
 * }</pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public class IndexSchema {

  private final String indexName;
  private final List<FieldSpec> fields;
  private final boolean storeByteOffsets;
  private final int sortableCount;

  @ToString.Exclude @EqualsAndHashCode.Exclude private final Map<String, FieldSpec> fieldsByName;

  /**
   * Constructs a schema. A defensive immutable copy of the field list is kept.
   *
   * @param indexName the name of the index (not null)
   * @param fields the field specs in schema order (may be null or empty)
   * @param storeByteOffsets whether documents indexed into this schema track token byte offsets
   */
  public IndexSchema(String indexName, List<FieldSpec> fields, boolean storeByteOffsets) {
    this.indexName = indexName;
    this.fields = fields == null ? Collections.emptyList() : List.copyOf(fields);
    this.storeByteOffsets = storeByteOffsets;

    Map<String, FieldSpec> map = new HashMap<>();
    int sortables = 0;
    for (FieldSpec field : this.fields) {
      map.put(field.getName().toLowerCase(Locale.ROOT), field);
      if (field.isSortable()) {
        sortables++;
      }
    }
    this.fieldsByName = Collections.unmodifiableMap(map);
    this.sortableCount = sortables;
  }

  /**
   * Retrieves the spec of a field by name, ignoring case.
   *
   * @param name field name (may be null)
   * @return the matching spec, or null if the schema has no such field
   */
  public FieldSpec getField(String name) {
    if (name == null) {
      return null;
    }
    return fieldsByName.get(name.toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the fields that can be indexed as the given type, in schema order.
   *
   * @param type the index type
   * @return an immutable list, possibly empty
   */
  public List<FieldSpec> getFieldsByType(IndexFieldType type) {
    return fields.stream().filter(f -> f.isFieldType(type)).toList();
  }

  /**
   * Returns the sort vector slot of a field, or -1 if the field does not exist or is not sortable.
   */
  public int getFieldSortingIndex(String name) {
    FieldSpec field = getField(name);
    if (field == null || !field.isSortable()) {
      return -1;
    }
    return field.getSortIndex();
  }
}
