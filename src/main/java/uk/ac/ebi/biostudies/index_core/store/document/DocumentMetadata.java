package uk.ac.ebi.biostudies.index_core.store.document;

import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** Per-document metadata kept in the {@link DocumentTable}. */
@Getter
@Setter
@ToString
public class DocumentMetadata {

  private final long id;
  private final String key;
  private double score;
  @ToString.Exclude private byte[] payload;
  private SortingVector sortVector;
  @ToString.Exclude private ByteOffsets byteOffsets;
  private final Set<DocumentFlag> flags = EnumSet.noneOf(DocumentFlag.class);

  public DocumentMetadata(long id, String key, double score) {
    this.id = id;
    this.key = key;
    this.score = score;
  }

  public boolean isDeleted() {
    return flags.contains(DocumentFlag.DELETED);
  }

  public boolean hasFlag(DocumentFlag flag) {
    return flags.contains(flag);
  }
}
