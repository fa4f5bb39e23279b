package uk.ac.ebi.biostudies.index_core.gc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import uk.ac.ebi.biostudies.index_core.config.GcConfig;
import uk.ac.ebi.biostudies.index_core.index.management.IndexResolver;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.store.IndexStore;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeNode;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeTree;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;
import uk.ac.ebi.biostudies.index_core.store.postings.RepairResult;
import uk.ac.ebi.biostudies.index_core.store.tag.TagIndex;

/**
 * Incremental garbage collector of one index.
 *
 * <p>Each cycle ({@link #periodicCallback()}) runs three sub-collectors in order:
 *
 * <ol>
 *   <li>random term: repairs the postings of a weighted random term;
 *   <li>numeric: advances a persistent cursor over one numeric field's range tree and repairs the
 *       next range;
 *   <li>tag: repairs the postings of a random value of a random tag field.
 * </ol>
 *
 * <p>Repairs run in chunks of at most {@code gc.scan-size} blocks. Each chunk holds the index lock;
 * between chunks the lock is released and the index is re-resolved through an {@link IndexGuard}.
 * If the index was dropped or rebuilt, the running sub-collector stops and the cycle reports {@link
 * GcStatus#INDEX_INVALID}.
 *
 * <p>The frequency {@code hz} adapts: a cycle that frees bytes raises it by 20%, a cycle that frees
 * nothing lowers it by 1%, and {@link #onDelete()} raises it by 50%. It always stays within {@code
 * [gc.min-hz, gc.max-hz]}.
 */
@Slf4j
public class GarbageCollector {

  static final double HZ_GROWTH = 1.2;
  static final double HZ_DECAY = 0.99;
  static final double HZ_DELETE_BOOST = 1.5;

  @Getter private final String indexName;
  @Getter private final long specUniqueId;
  private final IndexResolver resolver;
  private final IndexStore store;
  private final SnapshotLoadingProbe loadingProbe;
  private final GcConfig config;
  private final Random random;

  @Getter private final GcStats stats = new GcStats();
  private final Object hzLock = new Object();
  private double hz;
  private boolean snapshotPossiblyLoading = true;
  private boolean terminated;
  private final List<NumericFieldGc> numericGcs = new ArrayList<>();

  public GarbageCollector(
      IndexSpec spec,
      IndexResolver resolver,
      IndexStore store,
      SnapshotLoadingProbe loadingProbe,
      GcConfig config,
      Random random) {
    this.indexName = spec.getName();
    this.specUniqueId = spec.getUniqueId();
    this.resolver = resolver;
    this.store = store;
    this.loadingProbe = loadingProbe;
    this.config = config;
    this.random = random;
    this.hz = clamp(config.getInitialHz());
  }

  /**
   * Runs one collection cycle.
   *
   * @return {@link GcStatus#INDEX_INVALID} if the index went away, {@link GcStatus#OK} otherwise
   * @throws IllegalStateException if the index structures violate an invariant the collector
   *     relies on
   */
  public synchronized GcStatus periodicCallback() {
    if (terminated) {
      return GcStatus.INDEX_INVALID;
    }
    if (snapshotPossiblyLoading) {
      if (loadingProbe.isLoading()) {
        log.info("Snapshot loading in progress, not performing GC on {}", indexName);
        return GcStatus.OK;
      }
      snapshotPossiblyLoading = false;
    }

    IndexGuard guard = new IndexGuard(resolver, indexName, specUniqueId);
    SweepResult cycle =
        collectRandomTerm(guard).plus(collectNumericIndex(guard)).plus(collectTagIndex(guard));

    stats.cycleCompleted(cycle.bytesFreed() > 0);
    synchronized (hzLock) {
      if (cycle.bytesFreed() > 0) {
        hz = Math.min(hz * HZ_GROWTH, config.getMaxHz());
      } else {
        hz = Math.max(hz * HZ_DECAY, config.getMinHz());
      }
    }
    log.debug(
        "GC cycle on {} removed {} records ({} bytes), new hz {}",
        indexName,
        cycle.docsRemoved(),
        cycle.bytesFreed(),
        getHz());
    return cycle.status();
  }

  /**
   * Repairs the postings of a weighted random term.
   *
   * @param guard identity check performed between chunks
   */
  public SweepResult collectRandomTerm(IndexGuard guard) {
    IndexSpec spec = guard.revalidate();
    if (spec == null) {
      log.warn("No index spec for GC {}", indexName);
      return SweepResult.invalid();
    }

    String term;
    spec.getLock().lock();
    try {
      term = spec.getRandomTerm(config.getRandomTermSampleSize(), random);
    } finally {
      spec.getLock().unlock();
    }
    if (term == null) {
      return SweepResult.empty();
    }
    log.debug("Garbage collecting for term '{}'", term);

    String keyName = spec.getTermKey(term);
    InvertedIndex idx = store.openInvertedIndex(keyName, false);
    Sweep sweep = new Sweep();
    int blockNum = 0;
    while (idx != null) {
      long start = System.nanoTime();
      RepairResult result = repairChunk(spec, idx, blockNum);
      log.debug("Repair took {}ns", System.nanoTime() - start);
      sweep.add(result);
      blockNum = result.nextCursor();
      if (blockNum == 0) {
        break;
      }
      spec = guard.revalidate();
      if (spec == null) {
        sweep.invalidate();
        break;
      }
      idx = store.openInvertedIndex(keyName, false);
    }

    if (sweep.docsRemoved > 0) {
      log.debug(
          "Garbage collected {} bytes in {} records for term '{}'",
          sweep.bytesFreed,
          sweep.docsRemoved,
          term);
    }
    return sweep.toResult();
  }

  /**
   * Advances the cursor of a random numeric field and repairs the next range.
   *
   * @param guard identity check performed between chunks
   * @throws IllegalStateException if numeric fields disappeared from the schema, a numeric index
   *     cannot be opened, or a tree cursor is in an impossible state
   */
  public SweepResult collectNumericIndex(IndexGuard guard) {
    IndexSpec spec = guard.revalidate();
    if (spec == null) {
      log.warn("No index spec for GC {}", indexName);
      return SweepResult.invalid();
    }
    List<FieldSpec> numericFields = spec.getFieldsByType(IndexFieldType.NUMERIC);
    if (numericFields.isEmpty()) {
      return SweepResult.empty();
    }

    NumericFieldGc cursor;
    NumericRangeNode node;
    ReentrantLock lock = spec.getLock();
    lock.lock();
    try {
      if (numericFields.size() != numericGcs.size()) {
        if (numericFields.size() < numericGcs.size()) {
          throw new IllegalStateException(
              "Numeric fields cannot be removed from live index " + indexName);
        }
        rebuildNumericCursors(spec, numericFields);
      }

      int randomIndex = random.nextInt(numericGcs.size());
      cursor = numericGcs.get(randomIndex);
      String keyName = spec.getFormattedKey(numericFields.get(randomIndex), IndexFieldType.NUMERIC);
      NumericRangeTree tree = store.openNumericIndex(keyName, true);
      if (tree == null) {
        throw new IllegalStateException("Numeric index failed to open: " + keyName);
      }
      if (!cursor.isValidFor(tree)) {
        if (cursor.getTree() == tree && cursor.getRevisionId() >= tree.getRevisionId()) {
          throw new IllegalStateException(
              "Numeric cursor revision " + cursor.getRevisionId() + " is ahead of its tree");
        }
        log.debug("Numeric tree {} changed, recreating its cursor", keyName);
        cursor = new NumericFieldGc(tree);
        numericGcs.set(randomIndex, cursor);
      }
      node = cursor.nextGcNode();
    } finally {
      lock.unlock();
    }

    Sweep sweep = new Sweep();
    int blockNum = 0;
    for (;;) {
      RepairResult result;
      lock.lock();
      try {
        if (cursor.isStale()) {
          log.debug("Numeric tree of {} restructured during GC, stopping", indexName);
          break;
        }
        InvertedIndex entries = node.getRange().getEntries();
        result = entries.repair(spec.getDocs(), blockNum, config.getScanSize());
        cursor.getTree().entriesRemoved(result.docsRemoved());
        updateStats(spec, result);
      } finally {
        lock.unlock();
      }
      sweep.add(result);
      blockNum = result.nextCursor();
      if (blockNum == 0) {
        break;
      }
      spec = guard.revalidate();
      if (spec == null) {
        sweep.invalidate();
        break;
      }
      if (cursor.isStale()) {
        break;
      }
    }
    return sweep.toResult();
  }

  /**
   * Repairs the postings of a random value of a random tag field.
   *
   * @param guard identity check performed between chunks
   */
  public SweepResult collectTagIndex(IndexGuard guard) {
    IndexSpec spec = guard.revalidate();
    if (spec == null) {
      log.warn("No index spec for GC {}", indexName);
      return SweepResult.invalid();
    }
    List<FieldSpec> tagFields = spec.getFieldsByType(IndexFieldType.TAG);
    if (tagFields.isEmpty()) {
      return SweepResult.empty();
    }
    FieldSpec field = tagFields.get(random.nextInt(tagFields.size()));
    String keyName = spec.getFormattedKey(field, IndexFieldType.TAG);

    TagIndex tagIndex = store.openTagIndex(keyName, false);
    if (tagIndex == null) {
      return SweepResult.empty();
    }
    String value;
    InvertedIndex iv;
    spec.getLock().lock();
    try {
      value = tagIndex.randomValue(random);
      iv = value == null ? null : tagIndex.find(value);
    } finally {
      spec.getLock().unlock();
    }
    if (iv == null) {
      return SweepResult.empty();
    }

    Sweep sweep = new Sweep();
    int blockNum = 0;
    for (;;) {
      RepairResult result = repairChunk(spec, iv, blockNum);
      sweep.add(result);
      blockNum = result.nextCursor();
      if (blockNum == 0) {
        break;
      }
      spec = guard.revalidate();
      if (spec == null) {
        sweep.invalidate();
        break;
      }
      tagIndex = store.openTagIndex(keyName, false);
      if (tagIndex == null) {
        break;
      }
      spec.getLock().lock();
      try {
        iv = tagIndex.find(value);
      } finally {
        spec.getLock().unlock();
      }
      if (iv == null) {
        break;
      }
    }
    return sweep.toResult();
  }

  /** Hints that a document was deleted: raises the frequency by 50%, up to the maximum. */
  public void onDelete() {
    synchronized (hzLock) {
      hz = Math.min(hz * HZ_DELETE_BOOST, config.getMaxHz());
    }
  }

  /** Releases the numeric cursors. The collector reports an invalid index from then on. */
  public synchronized void onTerm() {
    numericGcs.clear();
    terminated = true;
    log.debug("GC for {} terminated", indexName);
  }

  public double getHz() {
    synchronized (hzLock) {
      return hz;
    }
  }

  /** Returns the delay until the next cycle, {@code 1 / hz} seconds. */
  public Duration getInterval() {
    return Duration.ofNanos((long) Math.floor(1_000_000_000.0 / getHz()));
  }

  /** Returns the collector figures reported by index introspection. */
  public Map<String, Object> renderStats() {
    Map<String, Object> rendered = new LinkedHashMap<>();
    rendered.put("current_hz", getHz());
    rendered.put("bytes_collected", (double) stats.getTotalCollected());
    rendered.put("effective_cycles_rate", stats.getEffectiveCyclesRate());
    rendered.put("records_collected", stats.getTotalRemoved());
    rendered.put("cycles", stats.getNumCycles());
    return rendered;
  }

  int getNumericCursorCount() {
    return numericGcs.size();
  }

  private void rebuildNumericCursors(IndexSpec spec, List<FieldSpec> numericFields) {
    numericGcs.clear();
    for (FieldSpec field : numericFields) {
      String keyName = spec.getFormattedKey(field, IndexFieldType.NUMERIC);
      NumericRangeTree tree = store.openNumericIndex(keyName, true);
      if (tree == null) {
        throw new IllegalStateException("Numeric index failed to open: " + keyName);
      }
      numericGcs.add(new NumericFieldGc(tree));
    }
  }

  private RepairResult repairChunk(IndexSpec spec, InvertedIndex idx, int blockNum) {
    spec.getLock().lock();
    try {
      RepairResult result = idx.repair(spec.getDocs(), blockNum, config.getScanSize());
      updateStats(spec, result);
      return result;
    } finally {
      spec.getLock().unlock();
    }
  }

  private void updateStats(IndexSpec spec, RepairResult result) {
    spec.getStats().recordsRemoved(result.docsRemoved(), result.bytesFreed());
    stats.collected(result.docsRemoved(), result.bytesFreed());
  }

  private double clamp(double value) {
    return Math.max(config.getMinHz(), Math.min(value, config.getMaxHz()));
  }

  /** Running totals of one sub-collector. */
  private static final class Sweep {
    private long docsRemoved;
    private long bytesFreed;
    private boolean invalid;

    void add(RepairResult result) {
      docsRemoved += result.docsRemoved();
      bytesFreed += result.bytesFreed();
    }

    void invalidate() {
      invalid = true;
    }

    SweepResult toResult() {
      return new SweepResult(
          docsRemoved, bytesFreed, invalid ? GcStatus.INDEX_INVALID : GcStatus.OK);
    }
  }
}
