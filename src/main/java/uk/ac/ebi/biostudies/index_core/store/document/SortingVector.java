package uk.ac.ebi.biostudies.index_core.store.document;

import java.util.Arrays;
import java.util.Locale;

/**
 * Per-document array of precomputed sortable values, indexed by the schema's sort slots. Strings
 * are stored normalized to lower case; numbers as doubles.
 */
public class SortingVector {

  private final Object[] values;

  public SortingVector(int length) {
    this.values = new Object[length];
  }

  public void putString(int index, String value) {
    checkIndex(index);
    values[index] = value == null ? null : value.toLowerCase(Locale.ROOT);
  }

  public void putNumber(int index, double value) {
    checkIndex(index);
    values[index] = value;
  }

  /** Returns the value at a slot: a String, a Double, or null if unset. */
  public Object get(int index) {
    checkIndex(index);
    return values[index];
  }

  public int length() {
    return values.length;
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= values.length) {
      throw new IndexOutOfBoundsException(
          "Sort slot " + index + " out of range for vector of length " + values.length);
    }
  }

  @Override
  public String toString() {
    return "SortingVector" + Arrays.toString(values);
  }
}
