package com.onthegomap.tilefetch.fetch;

import com.onthegomap.tilefetch.geo.TileCoord;

/**
 * Outcome of requesting a single tile from the remote server.
 */
public sealed interface TileFetchResult {

  TileCoord coord();

  default boolean isOk() {
    return this instanceof Ok;
  }

  /** The server returned an image payload. */
  record Ok(TileCoord coord, byte[] bytes) implements TileFetchResult {

    @Override
    public String toString() {
      return "Ok[" + coord + " " + bytes.length + " bytes]";
    }
  }

  /** The request completed but the response was not a usable tile. */
  record Rejected(TileCoord coord, String reason) implements TileFetchResult {}

  /** The request failed before a response arrived. */
  record TransportError(TileCoord coord, String reason) implements TileFetchResult {}
}
