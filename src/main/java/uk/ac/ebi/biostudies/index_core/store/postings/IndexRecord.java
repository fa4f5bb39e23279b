package uk.ac.ebi.biostudies.index_core.store.postings;

import java.util.Arrays;
import lombok.Getter;

/**
 * One entry of a postings list. Term postings carry frequency, field mask and token positions;
 * numeric postings carry the value; tag postings carry the document id only.
 *
 * <p>The encoded size is computed once at construction and is the amount credited back to the
 * index statistics when the record is collected.
 */
@Getter
public final class IndexRecord {

  private final long docId;
  private final int freq;
  private final long fieldMask;
  private final double numericValue;
  private final int[] positions;
  private final int encodedSize;

  private IndexRecord(
      long docId, int freq, long fieldMask, double numericValue, int[] positions, int encodedSize) {
    this.docId = docId;
    this.freq = freq;
    this.fieldMask = fieldMask;
    this.numericValue = numericValue;
    this.positions = positions;
    this.encodedSize = encodedSize;
  }

  public static IndexRecord term(long docId, int freq, long fieldMask, int[] positions) {
    int size = Varint.size(docId) + Varint.size(freq) + Varint.size(fieldMask);
    int last = 0;
    for (int pos : positions) {
      size += Varint.size(pos - last);
      last = pos;
    }
    return new IndexRecord(docId, freq, fieldMask, 0, positions.clone(), size);
  }

  public static IndexRecord numeric(long docId, double value) {
    return new IndexRecord(docId, 1, 0, value, new int[0], Varint.size(docId) + Double.BYTES);
  }

  public static IndexRecord tag(long docId) {
    return new IndexRecord(docId, 1, 0, 0, new int[0], Varint.size(docId));
  }

  public int[] getPositions() {
    return positions.clone();
  }

  @Override
  public String toString() {
    return "IndexRecord{docId="
        + docId
        + ", freq="
        + freq
        + ", value="
        + numericValue
        + ", positions="
        + Arrays.toString(positions)
        + '}';
  }
}
