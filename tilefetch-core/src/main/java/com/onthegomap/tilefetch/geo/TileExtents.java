package com.onthegomap.tilefetch.geo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The range of tiles covering a {@link BoundingBox} on each zoom level from a minimum to maximum zoom.
 * <p>
 * Both the up-front estimate shown to a user and the total a download reports progress against come from
 * {@link #compute(BoundingBox, int, int)} so they always agree.
 */
public class TileExtents implements Iterable<TileExtents.ForZoom> {

  private final List<ForZoom> zoomExtents;
  private final long totalTiles;

  private TileExtents(List<ForZoom> zoomExtents) {
    this.zoomExtents = List.copyOf(zoomExtents);
    this.totalTiles = zoomExtents.stream().mapToLong(ForZoom::count).sum();
  }

  /** Returns the tile range covering {@code bounds} on a single zoom level. */
  public static ForZoom forZoom(BoundingBox bounds, int zoom) {
    // latitude increases to the north while tile rows increase to the south, so the max row comes from the min lat
    // past the edge of the mercator map rows wrap around, so limit the box to the map first
    double minLat = Math.max(-GeoUtils.MAX_LAT, bounds.minLat());
    double maxLat = Math.min(GeoUtils.MAX_LAT, bounds.maxLat());
    TileCoord southWest = TileCoord.aroundLngLat(bounds.minLon(), minLat, zoom);
    TileCoord northEast = TileCoord.aroundLngLat(bounds.maxLon(), maxLat, zoom);
    int max = (1 << zoom) - 1;
    return new ForZoom(zoom,
      clamp(southWest.x(), max), clamp(northEast.x(), max),
      clamp(northEast.y(), max), clamp(southWest.y(), max));
  }

  private static int clamp(int value, int max) {
    return Math.max(0, Math.min(max, value));
  }

  /** Returns the tile ranges covering {@code bounds} on every zoom level from {@code minzoom} to {@code maxzoom}. */
  public static TileExtents compute(BoundingBox bounds, int minzoom, int maxzoom) {
    if (minzoom > maxzoom) {
      throw new IllegalArgumentException("minzoom " + minzoom + " is greater than maxzoom " + maxzoom);
    }
    List<ForZoom> result = new ArrayList<>();
    for (int zoom = minzoom; zoom <= maxzoom; zoom++) {
      result.add(forZoom(bounds, zoom));
    }
    return new TileExtents(result);
  }

  public int minzoom() {
    return zoomExtents.get(0).z();
  }

  public int maxzoom() {
    return zoomExtents.get(zoomExtents.size() - 1).z();
  }

  /** Sum of {@link ForZoom#count()} over every zoom level. */
  public long totalTiles() {
    return totalTiles;
  }

  /** Number of tiles on each zoom level, ordered by zoom. */
  public SortedMap<Integer, Long> tilesPerZoom() {
    SortedMap<Integer, Long> result = new TreeMap<>();
    for (var forZoom : zoomExtents) {
      result.put(forZoom.z(), forZoom.count());
    }
    return Collections.unmodifiableSortedMap(result);
  }

  @Override
  public Iterator<ForZoom> iterator() {
    return zoomExtents.iterator();
  }

  @Override
  public String toString() {
    return "TileExtents{z" + minzoom() + "-z" + maxzoom() + " totalTiles=" + totalTiles + " " + zoomExtents + "}";
  }

  /**
   * X/Y extents within a given zoom level, all bounds are inclusive and {@code y} uses XYZ row numbering.
   */
  public record ForZoom(int z, int minX, int maxX, int minY, int maxY) implements Iterable<TileCoord> {

    public long count() {
      return (long) (maxX - minX + 1) * (maxY - minY + 1);
    }

    /** Iterates over every tile in this range, columns first then rows within each column. */
    @Override
    public Iterator<TileCoord> iterator() {
      return new Iterator<>() {
        private int x = minX;
        private int y = minY;

        @Override
        public boolean hasNext() {
          return x <= maxX && minY <= maxY;
        }

        @Override
        public TileCoord next() {
          if (!hasNext()) {
            throw new NoSuchElementException();
          }
          TileCoord result = TileCoord.ofXYZ(x, y, z);
          if (++y > maxY) {
            y = minY;
            x++;
          }
          return result;
        }
      };
    }
  }
}
