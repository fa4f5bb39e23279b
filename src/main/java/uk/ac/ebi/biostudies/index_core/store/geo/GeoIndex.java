package uk.ac.ebi.biostudies.index_core.store.geo;

import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Geo index of one field: the point of every document that has one. Entries are removed eagerly
 * when their document is deleted, so the garbage collector never visits this structure.
 *
 * <p>Not thread-safe: callers hold the owning index's lock.
 */
@Slf4j
public class GeoIndex {

  private final Map<Long, GeoPoint> points = new HashMap<>();

  /**
   * Parses and adds a point for a document.
   *
   * @param docId the document id
   * @param longitude longitude text
   * @param latitude latitude text
   * @return false if either coordinate is not a number or the point is out of range
   */
  public boolean addStrings(long docId, String longitude, String latitude) {
    double lon;
    double lat;
    try {
      lon = Double.parseDouble(longitude.trim());
      lat = Double.parseDouble(latitude.trim());
    } catch (NumberFormatException e) {
      log.debug("Invalid geo coordinates '{}', '{}' for doc {}", longitude, latitude, docId);
      return false;
    }
    if (!GeoPoint.isValid(lon, lat)) {
      log.debug("Geo coordinates out of range '{}', '{}' for doc {}", longitude, latitude, docId);
      return false;
    }
    points.put(docId, new GeoPoint(lon, lat));
    return true;
  }

  public GeoPoint get(long docId) {
    return points.get(docId);
  }

  public boolean remove(long docId) {
    return points.remove(docId) != null;
  }

  public int size() {
    return points.size();
  }
}
