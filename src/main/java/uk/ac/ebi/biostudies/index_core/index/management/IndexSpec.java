package uk.ac.ebi.biostudies.index_core.index.management;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.Setter;
import uk.ac.ebi.biostudies.index_core.gc.GarbageCollector;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentTable;

/**
 * A live index: schema, document table, statistics and term dictionary, plus the garbage collector
 * attached to it.
 *
 * <p>The {@link #getUniqueId() uniqueId} identifies this incarnation of the index. Dropping and
 * recreating an index under the same name produces a new spec with a different uniqueId, which is
 * how holders of a cached name detect that the index they knew is gone.
 *
 * <p>Mutations of the document table, the term dictionary and the index structures happen while
 * holding {@link #getLock()}.
 */
@Getter
public class IndexSpec {

  private final String name;
  private final long uniqueId;
  private final IndexSchema schema;
  private final DocumentTable docs = new DocumentTable();
  private final IndexStats stats = new IndexStats();
  private final ReentrantLock lock = new ReentrantLock();

  @Setter private volatile GarbageCollector gc;

  // term -> number of documents it was written for
  private final Map<String, Long> termDocs = new HashMap<>();
  private final List<String> terms = new ArrayList<>();

  public IndexSpec(IndexSchema schema, long uniqueId) {
    this.name = schema.getIndexName();
    this.schema = schema;
    this.uniqueId = uniqueId;
  }

  public FieldSpec getField(String fieldName) {
    return schema.getField(fieldName);
  }

  public List<FieldSpec> getFieldsByType(IndexFieldType type) {
    return schema.getFieldsByType(type);
  }

  /** Returns the store key of a field's structure of the given type, e.g. {@code nm:idx/price}. */
  public String getFormattedKey(FieldSpec field, IndexFieldType type) {
    return getKeyPrefix(type) + field.getName();
  }

  /** Returns the store key of a term's postings, e.g. {@code ft:idx/hello}. */
  public String getTermKey(String term) {
    return getKeyPrefix(IndexFieldType.FULLTEXT) + term;
  }

  /** Returns the prefix shared by every store key of the given type in this index. */
  public String getKeyPrefix(IndexFieldType type) {
    return type.getKeyPrefix() + ":" + name + "/";
  }

  /**
   * Records that a term was written for one more document.
   *
   * @return true if the term is new to the index
   */
  public boolean recordTerm(String term) {
    long count = termDocs.merge(term, 1L, Long::sum);
    if (count == 1L) {
      terms.add(term);
      stats.termAdded();
      return true;
    }
    return false;
  }

  /**
   * Picks a term at random, weighted by the number of documents it was written for. A sample of
   * {@code sampleSize} terms is drawn uniformly, and one of them is chosen with probability
   * proportional to its weight.
   *
   * @param sampleSize number of candidate terms
   * @param random random source
   * @return a term, or null if the index has none
   */
  public String getRandomTerm(int sampleSize, Random random) {
    if (terms.isEmpty()) {
      return null;
    }
    String[] sample = new String[Math.max(1, sampleSize)];
    long[] weights = new long[sample.length];
    long total = 0;
    for (int i = 0; i < sample.length; i++) {
      sample[i] = terms.get(random.nextInt(terms.size()));
      weights[i] = Math.max(1L, termDocs.getOrDefault(sample[i], 1L));
      total += weights[i];
    }
    long pick = (long) (random.nextDouble() * total);
    for (int i = 0; i < sample.length; i++) {
      pick -= weights[i];
      if (pick < 0) {
        return sample[i];
      }
    }
    return sample[sample.length - 1];
  }

  public int getNumTerms() {
    return terms.size();
  }
}
