package uk.ac.ebi.biostudies.index_core.registry.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.index_core.registry.dto.FieldSpecDto;
import uk.ac.ebi.biostudies.index_core.registry.dto.IndexSchemaDto;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;

/**
 * Maps JSON schema definitions into {@link IndexSchema} objects.
 *
 * <p>Slots are assigned while converting: every field gets the next schema slot, every sortable
 * field the next sort vector slot, and every full-text field the next full-text field id.
 *
 * <pre>{@code
 * List<IndexSchema> schemas = new SchemaRegistryMapper().fromJson(json);
 * }</pre>
 */
@Slf4j
@Component
public class SchemaRegistryMapper {

  private ObjectMapper objectMapper;

  /**
   * Initializes the mapper with a Jackson ObjectMapper accepting case-insensitive enum values, so
   * that "fulltext" maps to {@link IndexFieldType#FULLTEXT}.
   */
  public SchemaRegistryMapper() {
    objectMapper = new ObjectMapper();
    objectMapper =
        objectMapper.setConfig(
            objectMapper
                .getDeserializationConfig()
                .with(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS));
  }

  /**
   * Parses the given JSON array into index schemas.
   *
   * @param json JSON string holding an array of schema definitions
   * @return the schemas in declaration order
   * @throws IllegalArgumentException if the JSON is empty or cannot be parsed
   */
  public List<IndexSchema> fromJson(String json) {
    String errorMessage;

    if (json == null || json.isBlank()) {
      errorMessage = "Null or empty json provided.";
      log.error(errorMessage);
      throw new IllegalArgumentException(errorMessage);
    }

    List<IndexSchemaDto> dtoList;
    try {
      dtoList = objectMapper.readValue(json, new TypeReference<>() {});
    } catch (JsonProcessingException e) {
      errorMessage = "Failed to parse JSON array to schema registry.";
      log.error("{} {}", errorMessage, e.getOriginalMessage());
      throw new IllegalArgumentException(errorMessage, e);
    }

    if (dtoList == null || dtoList.isEmpty()) {
      errorMessage = "The parsed JSON produced empty data.";
      log.error(errorMessage);
      throw new IllegalArgumentException(errorMessage);
    }

    return dtoList.stream().map(this::toSchema).toList();
  }

  /**
   * Converts one schema DTO, assigning schema, sort and full-text slots by position.
   *
   * @param dto the schema definition
   * @return the immutable schema
   */
  public IndexSchema toSchema(IndexSchemaDto dto) {
    List<FieldSpec> fields = new ArrayList<>();
    int sortIndex = 0;
    int ftId = 0;
    List<FieldSpecDto> fieldDtos = dto.getFields() == null ? List.of() : dto.getFields();
    for (int i = 0; i < fieldDtos.size(); i++) {
      FieldSpecDto fieldDto = fieldDtos.get(i);
      int fieldSortIndex = Boolean.TRUE.equals(fieldDto.getSortable()) ? sortIndex++ : -1;
      int fieldFtId =
          FieldSpecConverter.declares(fieldDto, IndexFieldType.FULLTEXT) ? ftId++ : -1;
      fields.add(FieldSpecConverter.fromDto(fieldDto, i, fieldSortIndex, fieldFtId));
    }
    return new IndexSchema(
        dto.getIndexName(), fields, Boolean.TRUE.equals(dto.getStoreByteOffsets()));
  }
}
