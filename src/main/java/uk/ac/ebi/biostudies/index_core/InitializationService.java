package uk.ac.ebi.biostudies.index_core;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.index_core.index.management.IndexManager;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;
import uk.ac.ebi.biostudies.index_core.registry.service.SchemaRegistryService;

/**
 * Service responsible for initializing application components upon startup.
 *
 * <p>This service listens for the {@link ApplicationReadyEvent} and:
 *
 * <ol>
 *   <li>loads and validates the schema registry;
 *   <li>creates one live index per declared schema, each with its garbage collector.
 * </ol>
 */
@Slf4j
@Service
public class InitializationService {

  private final SchemaRegistryService schemaRegistryService;
  private final IndexManager indexManager;

  public InitializationService(
      SchemaRegistryService schemaRegistryService, IndexManager indexManager) {
    this.schemaRegistryService = schemaRegistryService;
    this.indexManager = indexManager;
  }

  /**
   * Initializes all necessary components once the Spring application context is fully started.
   *
   * @throws IllegalStateException if any error occurs during initialization
   */
  @EventListener(ApplicationReadyEvent.class)
  public void initialize() {
    log.debug("Application initialization started");
    try {
      List<IndexSchema> schemas = schemaRegistryService.loadRegistry();
      log.debug("Schema registry loaded successfully");

      for (IndexSchema schema : schemas) {
        indexManager.createIndex(schema);
      }
      log.info("Application initialization completed: {} indexes ready", schemas.size());
    } catch (Exception e) {
      log.error("Application initialization failed", e);
      throw new IllegalStateException("Failed to initialize application components", e);
    }
  }
}
