package uk.ac.ebi.biostudies.index_core.registry.dto;

import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;

/**
 * Data Transfer Object used for JSON deserialization of field specs. Converted into immutable
 * {@link FieldSpec} objects once the whole schema has been read, since slots are assigned by
 * position.
 */
@Data
@NoArgsConstructor
public class FieldSpecDto {
  private String name;

  /** Index types of the field, e.g. ["fulltext"] or ["tag", "fulltext"]. */
  private List<IndexFieldType> types;

  private Boolean sortable;

  private Boolean noIndex;

  private Boolean noStem;

  private Boolean phonetic;

  private Boolean dynamic;

  /** Full-text weight. Null means 1.0. */
  private Double weight;

  /** Tag separator, a single character. Null means ",". */
  private String separator;

  private Boolean caseSensitive;
}
