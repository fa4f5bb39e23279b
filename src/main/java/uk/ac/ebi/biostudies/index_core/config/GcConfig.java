package uk.ac.ebi.biostudies.index_core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties of the per-index garbage collectors (prefix {@code gc.*}).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gc")
public class GcConfig {

  /** Whether a collector is started for every index created. */
  private boolean enabled = true;

  /** Maximum number of postings blocks repaired in one chunk. */
  private int scanSize = 100;

  /** Lower bound of the collector frequency, in cycles per second. */
  private double minHz = 1;

  /** Upper bound of the collector frequency, in cycles per second. */
  private double maxHz = 100;

  /** Frequency a new collector starts with. */
  private double initialHz = 10;

  /** Number of terms sampled when picking a weighted random term. */
  private int randomTermSampleSize = 20;
}
