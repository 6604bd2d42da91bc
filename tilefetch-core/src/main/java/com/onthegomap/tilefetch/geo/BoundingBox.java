package com.onthegomap.tilefetch.geo;

import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Envelope;

/**
 * A latitude/longitude rectangle to download tiles for, in degrees.
 */
@Immutable
public record BoundingBox(double minLat, double maxLat, double minLon, double maxLon) {

  public BoundingBox {
    if (!(minLat < maxLat)) {
      throw new IllegalArgumentException("minLat must be < maxLat, was " + minLat + " and " + maxLat);
    }
    if (!(minLon < maxLon)) {
      throw new IllegalArgumentException("minLon must be < maxLon, was " + minLon + " and " + maxLon);
    }
  }

  /** Returns the box that extends {@code buffer} degrees in every direction from {@code lat, lon}. */
  public static BoundingBox around(double lat, double lon, double buffer) {
    return new BoundingBox(lat - buffer, lat + buffer, lon - buffer, lon + buffer);
  }

  /** Returns this box as a JTS envelope where x is longitude and y is latitude. */
  public Envelope toEnvelope() {
    return new Envelope(minLon, maxLon, minLat, maxLat);
  }
}
