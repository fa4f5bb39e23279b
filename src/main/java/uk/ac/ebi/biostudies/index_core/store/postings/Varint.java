package uk.ac.ebi.biostudies.index_core.store.postings;

/** Size arithmetic for unsigned variable-length integers, 7 bits per byte. */
public final class Varint {

  private Varint() {
    throw new UnsupportedOperationException("Varint class cannot be instantiated");
  }

  /**
   * Returns the number of bytes needed to encode the given value.
   *
   * @param value a non-negative value
   * @return encoded length, between 1 and 10
   */
  public static int size(long value) {
    int bytes = 1;
    long v = value >>> 7;
    while (v != 0) {
      bytes++;
      v >>>= 7;
    }
    return bytes;
  }
}
