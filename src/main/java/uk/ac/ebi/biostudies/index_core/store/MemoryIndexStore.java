package uk.ac.ebi.biostudies.index_core.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.index_core.store.geo.GeoIndex;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeTree;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;
import uk.ac.ebi.biostudies.index_core.store.tag.TagIndex;

/** Heap-backed {@link IndexStore}. */
@Slf4j
@Component
public class MemoryIndexStore implements IndexStore {

  private final Map<String, Object> keys = new ConcurrentHashMap<>();
  private final int blockCapacity;
  private final int numericSplitThreshold;

  public MemoryIndexStore(
      @Value("${store.block-capacity:100}") int blockCapacity,
      @Value("${store.numeric-split-threshold:512}") int numericSplitThreshold) {
    this.blockCapacity = blockCapacity;
    this.numericSplitThreshold = numericSplitThreshold;
  }

  @Override
  public InvertedIndex openInvertedIndex(String keyName, boolean create) {
    return open(keyName, create, InvertedIndex.class, () -> new InvertedIndex(blockCapacity));
  }

  @Override
  public NumericRangeTree openNumericIndex(String keyName, boolean create) {
    return open(
        keyName,
        create,
        NumericRangeTree.class,
        () -> new NumericRangeTree(numericSplitThreshold, blockCapacity));
  }

  @Override
  public TagIndex openTagIndex(String keyName, boolean create) {
    return open(keyName, create, TagIndex.class, () -> new TagIndex(blockCapacity));
  }

  @Override
  public GeoIndex openGeoIndex(String keyName, boolean create) {
    return open(keyName, create, GeoIndex.class, GeoIndex::new);
  }

  @Override
  public int dropKeys(String prefix) {
    int before = keys.size();
    keys.keySet().removeIf(k -> k.startsWith(prefix));
    int dropped = before - keys.size();
    log.debug("Dropped {} keys with prefix {}", dropped, prefix);
    return dropped;
  }

  private <T> T open(String keyName, boolean create, Class<T> kind, Supplier<T> factory) {
    Object value = create ? keys.computeIfAbsent(keyName, k -> factory.get()) : keys.get(keyName);
    if (value == null) {
      return null;
    }
    if (!kind.isInstance(value)) {
      log.warn(
          "Key {} holds a {}, expected {}",
          keyName,
          value.getClass().getSimpleName(),
          kind.getSimpleName());
      return null;
    }
    return kind.cast(value);
  }
}
