package uk.ac.ebi.biostudies.index_core.metadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.index_core.gc.GarbageCollector;
import uk.ac.ebi.biostudies.index_core.index.management.IndexContainer;
import uk.ac.ebi.biostudies.index_core.index.management.IndexManager;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;
import uk.ac.ebi.biostudies.index_core.index.management.IndexStats;

/**
 * Introspection of the live indexes: document and postings counters plus the figures of each
 * index's garbage collector.
 */
@Slf4j
@Service
public class IndexInfoService {

  private final IndexContainer indexContainer;
  private final IndexManager indexManager;

  public IndexInfoService(IndexContainer indexContainer, IndexManager indexManager) {
    this.indexContainer = indexContainer;
    this.indexManager = indexManager;
  }

  /**
   * Retrieves information about every live index, sorted by name.
   *
   * @return one {@link IndexInfoDto} per index
   */
  public List<IndexInfoDto> getAllIndexesInfo() {
    List<IndexInfoDto> infos = new ArrayList<>();
    for (IndexSpec spec : indexContainer.getAll()) {
      infos.add(toDto(spec));
    }
    infos.sort(Comparator.comparing(IndexInfoDto::getName));
    return infos;
  }

  /**
   * Retrieves information about one index.
   *
   * @param indexName the index name
   * @return the index information
   * @throws IllegalStateException if the index does not exist
   */
  public IndexInfoDto getIndexInfo(String indexName) {
    return toDto(indexContainer.getIndex(indexName));
  }

  private IndexInfoDto toDto(IndexSpec spec) {
    IndexStats stats = spec.getStats();
    IndexInfoDto dto = new IndexInfoDto();
    dto.setName(spec.getName());
    dto.setUniqueId(spec.getUniqueId());
    dto.setNumberOfDocuments(stats.getNumDocuments());
    dto.setNumberOfTerms(stats.getNumTerms());
    dto.setNumberOfRecords(stats.getNumRecords());
    dto.setInvertedSize(stats.getInvertedSize());
    dto.setGcRunning(indexManager.isGcRunning(spec.getName()));
    GarbageCollector gc = spec.getGc();
    dto.setGcStats(gc == null ? Map.of() : gc.renderStats());
    return dto;
  }
}
