package com.onthegomap.tilefetch.config;

import com.onthegomap.tilefetch.fetch.TileSource;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Holder for common parameters used by many components in tilefetch.
 */
public record TileFetchConfig(
  Arguments arguments,
  TileSource tileSource,
  String httpUserAgent,
  Duration httpTimeout,
  Duration requestDelay,
  Path outputDir,
  Duration logInterval
) {

  public static final String DEFAULT_USER_AGENT = "MBTiles-Downloader/1.0";

  public TileFetchConfig {
    if (httpTimeout.isNegative() || httpTimeout.isZero()) {
      throw new IllegalArgumentException("HTTP timeout must be > 0, was " + httpTimeout);
    }
    if (requestDelay.isNegative()) {
      throw new IllegalArgumentException("Request delay must be >= 0, was " + requestDelay);
    }
    if (httpUserAgent == null || httpUserAgent.isBlank()) {
      throw new IllegalArgumentException("HTTP user agent must not be blank");
    }
  }

  public static TileFetchConfig defaults() {
    return from(Arguments.of());
  }

  public static TileFetchConfig from(Arguments arguments) {
    TileSource source = TileSource.ARCGIS_WORLD_IMAGERY;
    String url = arguments.getString("tile_url",
      "url template of the tile server with {z}, {x} and {y} placeholders", source.urlTemplate());
    return new TileFetchConfig(
      arguments,
      source.withUrlTemplate(url),
      arguments.getString("http_user_agent", "User-Agent header to set when requesting tiles", DEFAULT_USER_AGENT),
      arguments.getDuration("http_timeout", "Timeout to use when requesting a tile", "15s"),
      arguments.getDuration("request_delay", "Pause after each tile request to bound load on the tile server",
        "0.05s"),
      arguments.file("output_dir", "directory to write mbtiles archives to",
        Path.of(System.getProperty("java.io.tmpdir"))),
      arguments.getDuration("log_interval", "time between logs of download progress", "10s")
    );
  }
}
