package uk.ac.ebi.biostudies.index_core.registry.service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;

@Component
public class DefaultSchemaValidator implements SchemaValidator {

  /** Upper bound of full-text fields, as field ids are recorded in a 64-bit postings mask. */
  static final int MAX_FULLTEXT_FIELDS = Long.SIZE;

  @Override
  public void validate(IndexSchema schema) {
    if (schema == null) {
      throw new IllegalStateException("IndexSchema must not be null");
    }
    if (StringUtils.isBlank(schema.getIndexName())) {
      throw new IllegalStateException("Index name must not be blank");
    }
    if (StringUtils.containsAny(schema.getIndexName(), ':', '/')) {
      throw new IllegalStateException(
          "Index name must not contain ':' or '/': " + schema.getIndexName());
    }

    Set<String> names = new HashSet<>();
    int fullTextFields = 0;
    for (FieldSpec field : schema.getFields()) {
      validateName(schema, field, names);
      validateTypes(field);
      if (field.isFieldType(IndexFieldType.FULLTEXT)) {
        fullTextFields++;
      }
    }
    if (fullTextFields > MAX_FULLTEXT_FIELDS) {
      throw new IllegalStateException(
          "Too many full-text fields in index " + schema.getIndexName() + ": " + fullTextFields);
    }
  }

  private void validateName(IndexSchema schema, FieldSpec field, Set<String> names) {
    if (StringUtils.isBlank(field.getName())) {
      throw new IllegalStateException("Blank field name in index: " + schema.getIndexName());
    }
    if (!names.add(field.getName().toLowerCase(Locale.ROOT))) {
      throw new IllegalStateException(
          "Duplicate field '" + field.getName() + "' in index: " + schema.getIndexName());
    }
  }

  private void validateTypes(FieldSpec field) {
    if (field.getTypes() == null || field.getTypes().isEmpty()) {
      throw new IllegalStateException("Field has no index type: " + field.getName());
    }
    if (field.isFieldType(IndexFieldType.GEO) && field.getTypes().size() > 1) {
      throw new IllegalStateException("Geo field cannot have other types: " + field.getName());
    }
    if (field.isSortable() && field.isFieldType(IndexFieldType.GEO)) {
      throw new IllegalStateException("Geo field cannot be sortable: " + field.getName());
    }
    if (field.isNoIndex() && !field.isSortable()) {
      throw new IllegalStateException(
          "Field '" + field.getName() + "' is neither indexable nor sortable");
    }
  }
}
