package com.onthegomap.tilefetch.stats;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;
import net.jcip.annotations.Immutable;

/**
 * An immutable point-in-time copy of the progress of one download session.
 * <p>
 * {@code downloadedTiles} counts attempted tiles, including ones that failed.
 */
@Immutable
public record ProgressState(
  long totalTiles,
  long downloadedTiles,
  int currentZoom,
  DownloadStatus status,
  String error,
  Instant startTime,
  Instant lastUpdateTime,
  Path outputPath,
  String displayName,
  long fileSizeBytes,
  SortedMap<Integer, Long> tilesPerZoom
) {

  public ProgressState {
    tilesPerZoom = Collections.unmodifiableSortedMap(new TreeMap<>(tilesPerZoom));
  }

  /** Returns the state of a session that has been accepted but not started yet. */
  public static ProgressState idle(Instant now) {
    return new ProgressState(0, 0, 0, DownloadStatus.IDLE, null, now, now, null, null, 0, new TreeMap<>());
  }

  ProgressState downloading(long total, SortedMap<Integer, Long> perZoom, int zoom, Path output, Instant now) {
    return new ProgressState(total, 0, zoom, DownloadStatus.DOWNLOADING, null, now, now, output, displayName,
      fileSizeBytes, perZoom);
  }

  ProgressState advanced(int zoom, long delta, Instant now) {
    return new ProgressState(totalTiles, downloadedTiles + delta, zoom, status, error, startTime, now, outputPath,
      displayName, fileSizeBytes, tilesPerZoom);
  }

  ProgressState completed(Path output, String name, long size, Instant now) {
    return new ProgressState(totalTiles, downloadedTiles, currentZoom, DownloadStatus.COMPLETED, null, startTime, now,
      output, name, size, tilesPerZoom);
  }

  /** Returns this state moved to {@link DownloadStatus#ERROR} with {@code message}. */
  public ProgressState failed(String message, Instant now) {
    return new ProgressState(totalTiles, downloadedTiles, currentZoom, DownloadStatus.ERROR, message, startTime, now,
      null, displayName, 0, tilesPerZoom);
  }
}
