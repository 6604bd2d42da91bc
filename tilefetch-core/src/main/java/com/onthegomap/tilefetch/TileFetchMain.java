package com.onthegomap.tilefetch;

import com.onthegomap.tilefetch.config.Arguments;
import com.onthegomap.tilefetch.config.TileFetchConfig;
import com.onthegomap.tilefetch.stats.DownloadStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point that downloads a single area into an mbtiles archive.
 * <p>
 * For example: {@code java -jar tilefetch-core.jar --lat 12.9716 --lon 77.5946 --minzoom 10 --maxzoom 14 --name city}
 */
public class TileFetchMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileFetchMain.class);

  private TileFetchMain() {}

  public static void main(String[] args) throws InterruptedException {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    TileFetchConfig config = TileFetchConfig.from(arguments);
    DownloadRequest request;
    try {
      request = new DownloadRequest(
        arguments.getDouble("lat", "latitude of the center of the area to download"),
        arguments.getDouble("lon", "longitude of the center of the area to download"),
        arguments.getDouble("buffer", "degrees from the center to each edge of the area", 0.005),
        arguments.getInteger("minzoom", "minimum zoom level to download", 10),
        arguments.getInteger("maxzoom", "maximum zoom level to download", 16),
        arguments.getString("name", "name of the output archive", null)
      );
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid request: {}", e.getMessage());
      System.exit(2);
      return;
    }

    try (var service = DownloadService.create(config)) {
      String session = service.startDownload(request);
      var result = service.awaitAndLog(session, config.logInterval());
      if (result.status() != DownloadStatus.COMPLETED) {
        LOGGER.error("Download failed: {}", result.error());
        System.exit(1);
      }
      LOGGER.info("Wrote {} to {}", result.displayName(), result.outputPath());
    }
  }
}
