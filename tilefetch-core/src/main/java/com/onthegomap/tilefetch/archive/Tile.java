package com.onthegomap.tilefetch.archive;

import com.onthegomap.tilefetch.geo.TileCoord;
import java.util.Arrays;
import java.util.Objects;

/**
 * A validated tile image waiting to be written to an archive.
 *
 * @param coord XYZ coordinate of the tile, archives flip the row as needed
 * @param bytes encoded image
 */
public record Tile(TileCoord coord, byte[] bytes) implements Comparable<Tile> {

  @Override
  public boolean equals(Object o) {
    return (this == o) || (o instanceof Tile other && coord.equals(other.coord) && Arrays.equals(bytes, other.bytes));
  }

  @Override
  public int hashCode() {
    int result = coord.hashCode();
    result = 31 * result + Arrays.hashCode(bytes);
    return result;
  }

  @Override
  public String toString() {
    return "Tile{coord=" + coord + ", data=" + bytes.length + " bytes}";
  }

  @Override
  public int compareTo(Tile o) {
    int result = coord.compareTo(o.coord);
    return result != 0 ? result : Arrays.compare(bytes, o.bytes);
  }

  public static Tile of(TileCoord coord, byte[] bytes) {
    return new Tile(Objects.requireNonNull(coord), Objects.requireNonNull(bytes));
  }
}
