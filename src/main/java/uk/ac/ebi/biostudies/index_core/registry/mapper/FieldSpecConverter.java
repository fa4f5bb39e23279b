package uk.ac.ebi.biostudies.index_core.registry.mapper;

import java.util.EnumSet;
import uk.ac.ebi.biostudies.index_core.registry.dto.FieldSpecDto;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;

/**
 * Converts {@link FieldSpecDto} instances created by JSON deserialization into immutable {@link
 * FieldSpec} domain objects. Slot numbers are supplied by the caller because they depend on the
 * field's position in the schema.
 *
 * <p>This class contains static methods only and is not intended to be instantiated.
 */
public class FieldSpecConverter {

  private FieldSpecConverter() {
    // Prevent instantiation
  }

  /**
   * Converts a DTO into a field spec.
   *
   * @param dto the DTO instance to convert; must not be null
   * @param index schema slot of the field
   * @param sortIndex sort vector slot, or -1 if the field is not sortable
   * @param ftId full-text field id, or -1 if the field is not full-text
   * @return the constructed immutable FieldSpec
   * @throws IllegalArgumentException if name or types are missing, or the separator is not a single
   *     character
   */
  public static FieldSpec fromDto(FieldSpecDto dto, int index, int sortIndex, int ftId) {
    if (dto.getName() == null || dto.getTypes() == null || dto.getTypes().isEmpty()) {
      throw new IllegalArgumentException("Name and types must not be null");
    }
    if (dto.getSeparator() != null && dto.getSeparator().length() != 1) {
      throw new IllegalArgumentException(
          "Tag separator must be a single character in field: " + dto.getName());
    }

    return FieldSpec.builder()
        .name(dto.getName())
        .types(EnumSet.copyOf(dto.getTypes()))
        .index(index)
        .sortIndex(sortIndex)
        .ftId(ftId)
        .ftWeight(dto.getWeight() == null ? 1.0 : dto.getWeight())
        .sortable(Boolean.TRUE.equals(dto.getSortable()))
        .noIndex(Boolean.TRUE.equals(dto.getNoIndex()))
        .noStem(Boolean.TRUE.equals(dto.getNoStem()))
        .phonetics(Boolean.TRUE.equals(dto.getPhonetic()))
        .dynamic(Boolean.TRUE.equals(dto.getDynamic()))
        .tagSeparator(
            dto.getSeparator() == null
                ? FieldSpec.DEFAULT_TAG_SEPARATOR
                : dto.getSeparator().charAt(0))
        .tagCaseSensitive(Boolean.TRUE.equals(dto.getCaseSensitive()))
        .build();
  }

  /** Returns true if the DTO declares the given type. */
  static boolean declares(FieldSpecDto dto, IndexFieldType type) {
    return dto.getTypes() != null && dto.getTypes().contains(type);
  }
}
