package uk.ac.ebi.biostudies.index_core.registry.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Closed set of index structures a document field can be written to. A field may be indexed as
 * several types at once (for example a tag field that is also full-text searchable).
 *
 * <p>The declaration order is the order in which preprocessors run over a field: full-text,
 * numeric, geo, tag.
 */
public enum IndexFieldType {

  /** Tokenized text, written to per-term postings through the forward index. */
  FULLTEXT("fulltext", "ft"),

  /** Double values, written to a numeric range tree per field. */
  NUMERIC("numeric", "nm"),

  /** Longitude/latitude pairs, written to a geo index per field. */
  GEO("geo", "geo"),

  /** Separator-delimited values, written to a tag index per field. */
  TAG("tag", "tag");

  private final String name;
  private final String keyPrefix;

  IndexFieldType(String name, String keyPrefix) {
    this.name = name;
    this.keyPrefix = keyPrefix;
  }

  /** Returns the string representation used in JSON configuration. */
  public String getName() {
    return name;
  }

  /** Returns the prefix used when formatting index key names for this type. */
  public String getKeyPrefix() {
    return keyPrefix;
  }

  /**
   * Parses a string (e.g. from JSON) into its corresponding type. Returns null if no matching type
   * is found.
   */
  public static IndexFieldType fromName(String name) {
    for (IndexFieldType type : values()) {
      if (type.name.equalsIgnoreCase(name)) {
        return type;
      }
    }
    return null;
  }

  /** Returns an empty, mutable type set. */
  public static Set<IndexFieldType> none() {
    return EnumSet.noneOf(IndexFieldType.class);
  }

  /** Returns an immutable set holding the given types. */
  public static Set<IndexFieldType> of(IndexFieldType first, IndexFieldType... rest) {
    return Collections.unmodifiableSet(EnumSet.of(first, rest));
  }

  public static Set<String> allowedTypes() {
    return Arrays.stream(values()).map(IndexFieldType::getName).collect(Collectors.toSet());
  }

  @Override
  public String toString() {
    return name;
  }
}
