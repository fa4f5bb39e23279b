package uk.ac.ebi.biostudies.index_core.registry.loader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.index_core.registry.mapper.SchemaRegistryMapper;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;

/**
 * Loads index schemas from a JSON resource (e.g. {@code classpath:schema/indexes.json}) and
 * delegates parsing to {@link SchemaRegistryMapper}.
 *
 * <p>If the resource is missing or unreadable an {@link IllegalStateException} is thrown; parse
 * failures surface as {@link IllegalArgumentException} from the mapper.
 */
@Component
public class SchemaRegistryLoader {
  private final SchemaRegistryMapper registryMapper;
  private final ResourceLoader resourceLoader;

  private final Logger logger = LogManager.getLogger(SchemaRegistryLoader.class.getName());

  public SchemaRegistryLoader(SchemaRegistryMapper registryMapper, ResourceLoader resourceLoader) {
    this.registryMapper = registryMapper;
    this.resourceLoader = resourceLoader;
  }

  /**
   * Loads the schemas from a resource.
   *
   * @param resourceLocation the resource location (e.g., "classpath:schema/indexes.json")
   * @return the parsed schemas
   * @throws IllegalStateException if the resource cannot be read
   */
  public List<IndexSchema> loadFromResource(String resourceLocation) {
    logger.debug("Loading schema registry from {}", resourceLocation);
    Resource resource = resourceLoader.getResource(resourceLocation);
    if (!resource.exists()) {
      throw new IllegalStateException("Resource not found: " + resourceLocation);
    }
    String json;
    try (InputStream in = resource.getInputStream()) {
      json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
    List<IndexSchema> schemas = registryMapper.fromJson(json);
    logger.info("{} index schemas read from {}", schemas.size(), resourceLocation);
    return schemas;
  }
}
