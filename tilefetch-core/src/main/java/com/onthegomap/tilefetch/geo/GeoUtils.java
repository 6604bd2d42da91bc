package com.onthegomap.tilefetch.geo;

/**
 * Utilities for working with spherical web mercator coordinates.
 * <p>
 * "world" coordinates in this class refer to web mercator coordinates where the top-left/northwest corner of the map is
 * (0,0) and bottom-right/southeast corner is (1,1).
 */
public class GeoUtils {

  private static final double RADIANS_PER_DEGREE = Math.PI / 180;
  private static final double DEGREES_PER_RADIAN = 180 / Math.PI;
  /** Latitude of the north edge of the web mercator map, the south edge is its negation. */
  public static final double MAX_LAT = getWorldLat(0);

  // should not instantiate
  private GeoUtils() {}

  /**
   * Returns the longitude for a web mercator coordinate {@code x} where 0 is the international date line on the west
   * side, 1 is the international date line on the east side, and 0.5 is the prime meridian.
   */
  public static double getWorldLon(double x) {
    return x * 360 - 180;
  }

  /**
   * Returns the latitude for a web mercator {@code y} coordinate where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   */
  public static double getWorldLat(double y) {
    double n = Math.PI - 2 * Math.PI * y;
    return DEGREES_PER_RADIAN * Math.atan(0.5 * (Math.exp(n) - Math.exp(-n)));
  }

  /**
   * Returns the web mercator X coordinate for {@code longitude} where 0 is the international date line on the west
   * side, 1 is the international date line on the east side, and 0.5 is the prime meridian.
   */
  public static double getWorldX(double longitude) {
    return (longitude + 180) / 360;
  }

  /**
   * Returns the web mercator Y coordinate for {@code latitude} where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   * <p>
   * Values are not clamped, latitudes close to the poles land far outside of [0, 1].
   */
  public static double getWorldY(double latitude) {
    double tan = Math.tan(latitude * RADIANS_PER_DEGREE);
    // asinh(tan(lat))
    double asinh = Math.log(tan + Math.sqrt(tan * tan + 1));
    return (1 - asinh / Math.PI) / 2;
  }
}
