package uk.ac.ebi.biostudies.index_core.store.tag;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import uk.ac.ebi.biostudies.index_core.store.postings.IndexRecord;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;

/**
 * Tag index of one field: a postings list per distinct tag value.
 *
 * <p>Not thread-safe: callers hold the owning index's lock.
 */
public class TagIndex {

  private final int blockCapacity;
  private final Map<String, InvertedIndex> values = new HashMap<>();
  private final List<String> valueList = new ArrayList<>();

  public TagIndex() {
    this(InvertedIndex.DEFAULT_BLOCK_CAPACITY);
  }

  public TagIndex(int blockCapacity) {
    this.blockCapacity = blockCapacity;
  }

  /**
   * Splits raw field text into tag values: values are trimmed, empty values dropped, values
   * lower-cased unless the field is case sensitive, and duplicates removed.
   *
   * @param text the raw field text
   * @param separator the field's tag separator
   * @param caseSensitive whether to keep the original case
   * @return the distinct tag values in order of appearance, possibly empty
   */
  public static Set<String> splitTags(String text, char separator, boolean caseSensitive) {
    Set<String> tags = new LinkedHashSet<>();
    if (text == null) {
      return tags;
    }
    for (String value : Splitter.on(separator).trimResults().omitEmptyStrings().split(text)) {
      tags.add(caseSensitive ? value : value.toLowerCase(Locale.ROOT));
    }
    return tags;
  }

  /**
   * Indexes a document under each of the given tag values.
   *
   * @param tags tag values
   * @param docId the document id
   * @return bytes added to the postings
   */
  public long index(Collection<String> tags, long docId) {
    long bytes = 0;
    for (String tag : tags) {
      InvertedIndex postings = values.get(tag);
      if (postings == null) {
        postings = new InvertedIndex(blockCapacity);
        values.put(tag, postings);
        valueList.add(tag);
      }
      bytes += postings.append(IndexRecord.tag(docId));
    }
    return bytes;
  }

  /**
   * Picks a tag value uniformly at random.
   *
   * @param random the random source
   * @return a tag value, or null if the index holds none
   */
  public String randomValue(Random random) {
    if (valueList.isEmpty()) {
      return null;
    }
    return valueList.get(random.nextInt(valueList.size()));
  }

  /**
   * Finds the postings of a tag value.
   *
   * @param value the tag value
   * @return the postings, or null if the value is not present
   */
  public InvertedIndex find(String value) {
    return values.get(value);
  }

  /**
   * Drops a tag value and its postings.
   *
   * @param value the tag value
   * @return true if the value was present
   */
  public boolean remove(String value) {
    if (values.remove(value) == null) {
      return false;
    }
    valueList.remove(value);
    return true;
  }

  public int size() {
    return values.size();
  }
}
