package com.onthegomap.tilefetch.geo;

import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.CoordinateXY;

/**
 * The coordinate of a <a href="https://wiki.openstreetmap.org/wiki/Slippy_map_tilenames">slippy map tile</a>.
 * <p>
 * Tile coords sort by zoom level ascending, then x ascending, then y ascending which is the order tiles get requested
 * from the remote tile server.
 *
 * @param x x coordinate of the tile where 0 is the western-most tile just to the east the international date line and
 *          2^z-1 is the eastern-most tile
 * @param y y coordinate of the tile where 0 is the northern-most tile and 2^z-1 is the southern-most tile ("XYZ" row)
 * @param z zoom level
 */
@Immutable
public record TileCoord(int x, int y, int z) implements Comparable<TileCoord> {

  public static TileCoord ofXYZ(int x, int y, int z) {
    return new TileCoord(x, y, z);
  }

  /** Returns the tile at column {@code x} of zoom {@code z} whose TMS row (0 = southern-most) is {@code tmsY}. */
  public static TileCoord ofTms(int x, int tmsY, int z) {
    return new TileCoord(x, flipY(tmsY, z), z);
  }

  /** Converts between XYZ and TMS row numbering, the conversion is its own inverse. */
  public static int flipY(int y, int z) {
    return (1 << z) - 1 - y;
  }

  /** Returns the tile containing a latitude/longitude coordinate at a given zoom level. */
  public static TileCoord aroundLngLat(double lng, double lat, int zoom) {
    double factor = 1 << zoom;
    double x = GeoUtils.getWorldX(lng) * factor;
    double y = GeoUtils.getWorldY(lat) * factor;
    return TileCoord.ofXYZ((int) Math.floor(x), (int) Math.floor(y), zoom);
  }

  /** Returns the row of this tile in TMS numbering where 0 is the southern-most row, as stored in mbtiles files. */
  public int tmsY() {
    return flipY(y, z);
  }

  /** Returns the longitude (x) and latitude (y) of the northwest corner of this tile. */
  public CoordinateXY latLon() {
    double worldWidthAtZoom = Math.pow(2, z);
    return new CoordinateXY(
      GeoUtils.getWorldLon(x / worldWidthAtZoom),
      GeoUtils.getWorldLat(y / worldWidthAtZoom)
    );
  }

  @Override
  public int compareTo(TileCoord o) {
    int result = Integer.compare(z, o.z);
    if (result == 0) {
      result = Integer.compare(x, o.x);
    }
    if (result == 0) {
      result = Integer.compare(y, o.y);
    }
    return result;
  }

  @Override
  public String toString() {
    return "{x=" + x + " y=" + y + " z=" + z + '}';
  }
}
