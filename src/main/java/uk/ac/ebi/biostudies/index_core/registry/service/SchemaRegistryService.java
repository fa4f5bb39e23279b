package uk.ac.ebi.biostudies.index_core.registry.service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.index_core.Constants;
import uk.ac.ebi.biostudies.index_core.registry.loader.SchemaRegistryLoader;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;

/**
 * Loads, validates and serves the index schemas declared in configuration.
 *
 * <p>The service is initialized once at startup via {@link #loadRegistry()}. The schemas it serves
 * are the declared definitions; live indexes built from them (with their uniqueIds) are owned by
 * {@code IndexManager}.
 */
@Slf4j
@Service
public class SchemaRegistryService {

  @Getter private final SchemaRegistryLoader loader;
  @Getter private final SchemaValidator validator;

  private volatile Map<String, IndexSchema> schemas = Map.of();

  @Value("${schema.registry.location:" + Constants.DEFAULT_SCHEMA_LOCATION + "}")
  @Getter
  private String schemaRegistryLocation;

  public SchemaRegistryService(SchemaRegistryLoader loader, SchemaValidator validator) {
    this.loader = loader;
    this.validator = validator;
  }

  /**
   * Loads the schemas from {@link #schemaRegistryLocation}, validates each of them and publishes
   * them for lookup.
   *
   * @return the loaded schemas in declaration order
   * @throws IllegalStateException if the resource cannot be loaded, validation fails or two schemas
   *     share a name
   */
  public synchronized List<IndexSchema> loadRegistry() {
    log.debug("Loading schema registry from {}", schemaRegistryLocation);
    List<IndexSchema> loaded = loader.loadFromResource(schemaRegistryLocation);
    Map<String, IndexSchema> byName = new HashMap<>();
    for (IndexSchema schema : loaded) {
      validator.validate(schema);
      if (byName.put(schema.getIndexName(), schema) != null) {
        throw new IllegalStateException("Duplicate index name: " + schema.getIndexName());
      }
    }
    this.schemas = Map.copyOf(byName);
    log.debug("{} schemas successfully loaded", loaded.size());
    return loaded;
  }

  /**
   * Returns the declared schema of an index.
   *
   * @param indexName the index name (may be null)
   * @return the schema, or null if none was declared
   */
  public IndexSchema getSchema(String indexName) {
    if (indexName == null) {
      return null;
    }
    return schemas.get(indexName);
  }
}
