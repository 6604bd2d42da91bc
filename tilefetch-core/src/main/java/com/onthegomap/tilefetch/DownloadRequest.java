package com.onthegomap.tilefetch;

import com.onthegomap.tilefetch.geo.BoundingBox;
import com.onthegomap.tilefetch.geo.GeoUtils;
import java.time.Instant;
import java.util.Optional;

/**
 * A request to download every tile within {@code buffer} degrees of {@code lat, lon} from {@code minZoom} to
 * {@code maxZoom}.
 * <p>
 * The constructor rejects out-of-range values so an invalid request never creates a session. That includes areas
 * whose edges reach past the north or south edge of the web mercator map or across the antimeridian.
 *
 * @param lat        center latitude, strictly between -90 and 90
 * @param lon        center longitude, strictly between -180 and 180
 * @param buffer     distance in degrees from the center to each edge of the area, from 0.001 to 0.1
 * @param minZoom    first zoom level to download, from 1 to 21
 * @param maxZoom    last zoom level to download, from {@code minZoom} to 21
 * @param outputName optional name of the archive, or null to generate one
 */
public record DownloadRequest(double lat, double lon, double buffer, int minZoom, int maxZoom, String outputName) {

  public static final int MIN_ZOOM = 1;
  public static final int MAX_ZOOM = 21;
  public static final double MIN_BUFFER = 0.001;
  public static final double MAX_BUFFER = 0.1;
  public static final String EXTENSION = ".mbtiles";

  public DownloadRequest {
    if (!(lat > -90 && lat < 90) || !(lon > -180 && lon < 180)) {
      throw new IllegalArgumentException("Invalid coordinates: " + lat + ", " + lon);
    }
    if (minZoom < MIN_ZOOM || maxZoom > MAX_ZOOM || minZoom > maxZoom) {
      throw new IllegalArgumentException(
        "Invalid zoom levels: " + minZoom + "-" + maxZoom + " must be within " + MIN_ZOOM + "-" + MAX_ZOOM);
    }
    if (!(buffer >= MIN_BUFFER && buffer <= MAX_BUFFER)) {
      throw new IllegalArgumentException(
        "Buffer must be between " + MIN_BUFFER + " and " + MAX_BUFFER + " degrees, was " + buffer);
    }
    if (Math.abs(lat) + buffer > GeoUtils.MAX_LAT || Math.abs(lon) + buffer > 180) {
      throw new IllegalArgumentException(
        "Area within " + buffer + " degrees of " + lat + ", " + lon + " extends past the edge of the map");
    }
    outputName = outputName == null || outputName.isBlank() ? null : outputName.strip();
  }

  public DownloadRequest(double lat, double lon, double buffer, int minZoom, int maxZoom) {
    this(lat, lon, buffer, minZoom, maxZoom, null);
  }

  public BoundingBox bounds() {
    return BoundingBox.around(lat, lon, buffer);
  }

  /** Returns {@link #outputName} with everything except letters, digits, '_' and '-' replaced by '_'. */
  public Optional<String> sanitizedName() {
    if (outputName == null) {
      return Optional.empty();
    }
    String safe = outputName
      .replaceAll("[^a-zA-Z0-9_-]", "_")
      .replaceAll("_+", "_")
      .replaceAll("^_+|_+$", "");
    return safe.isEmpty() ? Optional.empty() : Optional.of(safe);
  }

  /** Returns the archive file name to write for this request if it starts at {@code now}. */
  public String fileName(Instant now) {
    return sanitizedName().orElse("output_" + now.getEpochSecond()) + EXTENSION;
  }

  /** Returns the name a user should see for the finished archive written to {@code fileName}. */
  public String displayName(String fileName) {
    return outputName != null ? outputName + EXTENSION : fileName;
  }
}
