package uk.ac.ebi.biostudies.index_core.store.geo;

/** A validated longitude/latitude pair. */
public record GeoPoint(double longitude, double latitude) {

  public static final double MIN_LAT = -85.05112878;
  public static final double MAX_LAT = 85.05112878;
  public static final double MIN_LON = -180;
  public static final double MAX_LON = 180;

  public static boolean isValid(double longitude, double latitude) {
    return longitude >= MIN_LON
        && longitude <= MAX_LON
        && latitude >= MIN_LAT
        && latitude <= MAX_LAT;
  }
}
