package uk.ac.ebi.biostudies.index_core.index;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;

/**
 * One named field of a {@link Document}. The {@code indexAs} set restricts the types the field is
 * indexed as; an empty set means "whatever the schema declares".
 */
@Getter
@ToString
public class DocumentField {

  private final String name;
  private final String text;
  private final Set<IndexFieldType> indexAs;

  public DocumentField(String name, String text) {
    this(name, text, Collections.emptySet());
  }

  public DocumentField(String name, String text, Set<IndexFieldType> indexAs) {
    this.name = name;
    this.text = text;
    this.indexAs =
        indexAs == null || indexAs.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(indexAs));
  }

  public boolean hasExplicitTypes() {
    return !indexAs.isEmpty();
  }
}
