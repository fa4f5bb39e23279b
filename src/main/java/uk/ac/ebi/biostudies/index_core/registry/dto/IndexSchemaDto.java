package uk.ac.ebi.biostudies.index_core.registry.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object representing an index schema as defined in JSON input. This class is mutable
 * and intended for deserialization only.
 *
 * <p>It mirrors the JSON structure: [ { "indexName": "idx", "storeByteOffsets": true, "fields": [
 * ... ] } ]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexSchemaDto {
  /** The name of the index. */
  private String indexName;

  /** Whether token byte offsets are stored for documents of this index. */
  private Boolean storeByteOffsets;

  /** Field definitions in schema order. */
  private List<FieldSpecDto> fields;
}
