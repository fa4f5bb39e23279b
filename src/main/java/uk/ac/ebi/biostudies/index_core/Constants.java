package uk.ac.ebi.biostudies.index_core;

/** Application-wide constant values. This class is non-instantiable. */
public final class Constants {

  /** Default location of the index schema declarations. */
  public static final String DEFAULT_SCHEMA_LOCATION = "classpath:schema/indexes.json";

  /** Spring profile used by the test suite. */
  public static final String TEST_PROFILE = "test";

  private Constants() {}
}
