package uk.ac.ebi.biostudies.index_core.index;

import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** Preprocessed value of one field, produced by a preprocessor and consumed at commit. */
@Getter
@Setter
@ToString
public class FieldIndexerData {

  private double numeric;
  private String geoLongitude;
  private String geoLatitude;
  private Set<String> tags;

  public boolean hasTags() {
    return tags != null && !tags.isEmpty();
  }
}
