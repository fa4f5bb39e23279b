package uk.ac.ebi.biostudies.index_core.store.document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Token byte offsets of a document, used to highlight matches without re-tokenizing. Each full-text
 * field contributes a span of token positions, and each token its byte offset in the field text.
 */
public class ByteOffsets {

  private final List<FieldSpan> fields;
  private int[] offsets = new int[16];
  private int numOffsets;

  public ByteOffsets(int expectedFields) {
    this.fields = new ArrayList<>(expectedFields);
  }

  public void addField(int fieldId, int firstTokPos, int lastTokPos) {
    fields.add(new FieldSpan(fieldId, firstTokPos, lastTokPos));
  }

  public void addTokenOffset(int byteOffset) {
    if (numOffsets == offsets.length) {
      offsets = Arrays.copyOf(offsets, offsets.length * 2);
    }
    offsets[numOffsets++] = byteOffset;
  }

  public List<FieldSpan> getFields() {
    return Collections.unmodifiableList(fields);
  }

  public int[] getOffsets() {
    return Arrays.copyOf(offsets, numOffsets);
  }

  /** Token positions covered by one full-text field. */
  public record FieldSpan(int fieldId, int firstTokPos, int lastTokPos) {}
}
