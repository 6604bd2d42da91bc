package com.onthegomap.tilefetch;

import com.onthegomap.tilefetch.archive.Tile;
import com.onthegomap.tilefetch.archive.TileArchiveMetadata;
import com.onthegomap.tilefetch.config.TileFetchConfig;
import com.onthegomap.tilefetch.fetch.TileFetchResult;
import com.onthegomap.tilefetch.fetch.TileFetcher;
import com.onthegomap.tilefetch.geo.TileCoord;
import com.onthegomap.tilefetch.geo.TileExtents;
import com.onthegomap.tilefetch.mbtiles.Mbtiles;
import com.onthegomap.tilefetch.stats.ProgressState;
import com.onthegomap.tilefetch.stats.ProgressTracker;
import com.onthegomap.tilefetch.util.FileUtils;
import com.onthegomap.tilefetch.util.Format;
import com.onthegomap.tilefetch.util.LogUtil;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single download session from start to finish: requests every tile in the area one zoom level at a time,
 * writes the valid ones to an mbtiles archive, and reports progress to a {@link ProgressTracker}.
 * <p>
 * Failed tiles are counted and skipped. A session that gets no tiles at all, or hits an unexpected exception, ends in
 * the error state with its partial archive deleted. {@link #run(String, DownloadRequest)} never throws, not even
 * for a session the tracker does not know about.
 */
public class DownloadOrchestrator {

  public static final String NO_TILES_MESSAGE = "No tiles were successfully downloaded";
  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadOrchestrator.class);

  private final TileFetchConfig config;
  private final TileFetcher fetcher;
  private final ProgressTracker tracker;

  public DownloadOrchestrator(TileFetchConfig config, TileFetcher fetcher, ProgressTracker tracker) {
    this.config = config;
    this.fetcher = fetcher;
    this.tracker = tracker;
  }

  /** Returns the path the archive for {@code request} gets written to if it starts now. */
  public Path outputPath(DownloadRequest request) {
    return config.outputDir().resolve(request.fileName(tracker.clock().instant()));
  }

  /**
   * Downloads the tiles for {@code request} into a new archive, recording progress under {@code session} which must
   * already be registered with the tracker.
   *
   * @return the final state of the session, either completed or error
   */
  public ProgressState run(String session, DownloadRequest request) {
    if (tracker.state(session).isEmpty()) {
      LOGGER.warn("Not downloading for unknown session {}", session);
      return unknownSession(session);
    }
    LogUtil.setStage(session);
    Path output = null;
    Optional<ProgressState> result;
    try {
      TileExtents extents = TileExtents.compute(request.bounds(), request.minZoom(), request.maxZoom());
      output = outputPath(request);
      tracker.init(session, extents.totalTiles(), extents.tilesPerZoom(), output);
      LOGGER.info("Starting download of {} tiles z{}-z{} around {},{} to {}",
        extents.totalTiles(), request.minZoom(), request.maxZoom(), request.lat(), request.lon(), output);

      Counts counts = download(session, request, extents, output);

      if (counts.successful == 0) {
        FileUtils.deleteArchive(output);
        result = tracker.fail(session, NO_TILES_MESSAGE);
        LOGGER.error("{} (attempted: {})", NO_TILES_MESSAGE, counts.attempted);
      } else {
        long size = FileUtils.size(output);
        String displayName = request.displayName(output.getFileName().toString());
        result = tracker.complete(session, output, displayName, size);
        LOGGER.info("Successfully created MBTiles {} with {} tiles (attempted: {}, failed: {}) {}",
          displayName, counts.successful, counts.attempted, counts.attempted - counts.successful,
          Format.defaultInstance().storage(size) + "B");
      }
    } catch (Throwable e) { // NOSONAR
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      String message = e.getMessage() != null ? e.getMessage() : e.toString();
      LOGGER.error("Error during tile download: {}", message, e);
      if (output != null) {
        FileUtils.deleteArchive(output);
      }
      result = tracker.fail(session, message);
    } finally {
      LogUtil.clearStage();
    }
    return result.orElseGet(() -> unknownSession(session));
  }

  private ProgressState unknownSession(String session) {
    Instant now = tracker.clock().instant();
    return ProgressState.idle(now).failed("Unknown session " + session, now);
  }

  private Counts download(String session, DownloadRequest request, TileExtents extents, Path output)
    throws InterruptedException {
    Counts counts = new Counts();
    FileUtils.createParentDirectories(output);
    FileUtils.deleteArchive(output);
    try (Mbtiles db = Mbtiles.newWriteToFileDatabase(output, config.arguments())) {
      db.createTables();
      db.metadataTable().set(TileArchiveMetadata.forDownload(
        fetcher.source(), request.bounds(), request.lat(), request.lon(), request.minZoom(), request.maxZoom()));
      try (var writer = db.newTileWriter()) {
        for (var forZoom : extents) {
          tracker.setCurrentZoom(session, forZoom.z());
          LOGGER.info("Processing zoom level {} ({} tiles)", forZoom.z(), forZoom.count());
          for (TileCoord coord : forZoom) {
            if (Thread.currentThread().isInterrupted()) {
              throw new InterruptedException("Download interrupted at " + coord);
            }
            if (fetcher.fetch(coord) instanceof TileFetchResult.Ok ok) {
              writer.write(Tile.of(coord, ok.bytes()));
              counts.successful++;
            }
            counts.attempted++;
            tracker.advance(session, forZoom.z(), 1);
          }
          writer.commit();
        }
      }
    } catch (IOException e) {
      throw new IllegalStateException("Unable to close " + output, e);
    }
    return counts;
  }

  private static class Counts {
    long attempted = 0;
    long successful = 0;
  }
}
