package com.onthegomap.tilefetch.archive;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.onthegomap.tilefetch.fetch.TileSource;
import com.onthegomap.tilefetch.geo.BoundingBox;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Metadata associated with a tile archive, written once before any tiles.
 * <p>
 * The default serialization corresponds to the
 * <a href="https://github.com/mapbox/mbtiles-spec/blob/master/1.3/spec.md#metadata">mbtiles spec</a>. As such each
 * value is a string.
 */
@JsonPropertyOrder({
  TileArchiveMetadata.NAME_KEY,
  TileArchiveMetadata.TYPE_KEY,
  TileArchiveMetadata.VERSION_KEY,
  TileArchiveMetadata.DESCRIPTION_KEY,
  TileArchiveMetadata.FORMAT_KEY,
  TileArchiveMetadata.BOUNDS_KEY,
  TileArchiveMetadata.MINZOOM_KEY,
  TileArchiveMetadata.MAXZOOM_KEY,
  TileArchiveMetadata.CENTER_KEY,
  TileArchiveMetadata.ATTRIBUTION_KEY
})
public record TileArchiveMetadata(
  @JsonProperty(NAME_KEY) String name,
  @JsonProperty(TYPE_KEY) String type,
  @JsonProperty(VERSION_KEY) String version,
  @JsonProperty(DESCRIPTION_KEY) String description,
  @JsonProperty(FORMAT_KEY) String format,
  @JsonProperty(BOUNDS_KEY)
  @JsonSerialize(using = TileArchiveMetadataDeSer.EnvelopeSerializer.class) Envelope bounds,
  @JsonProperty(MINZOOM_KEY)
  @JsonSerialize(using = ToStringSerializer.class) Integer minzoom,
  @JsonProperty(MAXZOOM_KEY)
  @JsonSerialize(using = ToStringSerializer.class) Integer maxzoom,
  @JsonProperty(CENTER_KEY)
  @JsonSerialize(using = TileArchiveMetadataDeSer.CoordinateSerializer.class) Coordinate center,
  @JsonProperty(ATTRIBUTION_KEY) String attribution
) {

  public static final String NAME_KEY = "name";
  public static final String TYPE_KEY = "type";
  public static final String VERSION_KEY = "version";
  public static final String DESCRIPTION_KEY = "description";
  public static final String FORMAT_KEY = "format";
  public static final String BOUNDS_KEY = "bounds";
  public static final String MINZOOM_KEY = "minzoom";
  public static final String MAXZOOM_KEY = "maxzoom";
  public static final String CENTER_KEY = "center";
  public static final String ATTRIBUTION_KEY = "attribution";

  public static final String BASELAYER = "baselayer";
  public static final String VERSION = "1.0";

  /**
   * Returns the metadata for a download of tiles from {@code source} covering {@code bounds}, centered on
   * {@code lat, lon} and opening at {@code minzoom}.
   */
  public static TileArchiveMetadata forDownload(TileSource source, BoundingBox bounds, double lat, double lon,
    int minzoom, int maxzoom) {
    return new TileArchiveMetadata(
      source.name(),
      BASELAYER,
      VERSION,
      source.description(),
      source.format(),
      bounds.toEnvelope(),
      minzoom,
      maxzoom,
      new Coordinate(lon, lat, minzoom),
      source.attribution()
    );
  }
}
