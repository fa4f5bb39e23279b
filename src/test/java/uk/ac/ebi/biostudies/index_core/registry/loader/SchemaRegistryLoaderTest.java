package uk.ac.ebi.biostudies.index_core.registry.loader;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import uk.ac.ebi.biostudies.index_core.registry.mapper.SchemaRegistryMapper;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;

class SchemaRegistryLoaderTest {

  private final SchemaRegistryLoader loader =
      new SchemaRegistryLoader(new SchemaRegistryMapper(), new DefaultResourceLoader());

  @Test
  void loadsSchemasFromClasspath() {
    List<IndexSchema> schemas = loader.loadFromResource("classpath:schema/test-indexes.json");

    assertEquals(1, schemas.size());
    IndexSchema schema = schemas.get(0);
    assertEquals("test", schema.getIndexName());
    assertEquals(6, schema.getFields().size());
    assertEquals(1, schema.getFieldsByType(IndexFieldType.TAG).size());
    assertTrue(schema.getField("views").isNoIndex());
  }

  @Test
  void missingResourceThrows() {
    IllegalStateException ex =
        assertThrows(
            IllegalStateException.class,
            () -> loader.loadFromResource("classpath:schema/missing.json"));
    assertTrue(ex.getMessage().startsWith("Resource not found"));
  }
}
