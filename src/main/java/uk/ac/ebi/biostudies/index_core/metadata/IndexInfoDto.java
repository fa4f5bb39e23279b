package uk.ac.ebi.biostudies.index_core.metadata;

import java.util.Map;
import lombok.Data;

@Data
public class IndexInfoDto {
  private String name;
  private long uniqueId;
  private long numberOfDocuments;
  private long numberOfTerms;
  private long numberOfRecords;
  private long invertedSize;
  private boolean gcRunning;
  private Map<String, Object> gcStats;
}
