package uk.ac.ebi.biostudies.index_core.registry.service;

import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;

public interface SchemaValidator {
  /**
   * Validates one index schema.
   *
   * @param schema the schema to validate (not null)
   * @throws IllegalStateException if any validation errors are found
   */
  void validate(IndexSchema schema);
}
