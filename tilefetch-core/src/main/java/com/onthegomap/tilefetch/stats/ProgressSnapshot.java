package com.onthegomap.tilefetch.stats;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.onthegomap.tilefetch.util.JsonUtils;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * A {@link ProgressState} along with rates and estimates derived from it at the time it was read.
 *
 * @param state              the raw session state
 * @param progressPercent    downloaded / total * 100 rounded to 1 decimal, or 0 when there is no total
 * @param elapsed            time since the session started
 * @param tilesPerSecond     downloaded / elapsed seconds rounded to 1 decimal, or 0 before the first tile
 * @param estimatedRemaining remaining tiles / rate, or 0 when the rate is 0
 * @param lastUpdateAge      time since the session last changed, callers can use it to spot a stalled download
 */
public record ProgressSnapshot(
  @JsonIgnore ProgressState state,
  double progressPercent,
  @JsonIgnore Duration elapsed,
  double tilesPerSecond,
  @JsonIgnore Duration estimatedRemaining,
  @JsonIgnore Duration lastUpdateAge
) {

  /** Computes derived metrics for {@code state} as of {@code now}. */
  public static ProgressSnapshot of(ProgressState state, Instant now) {
    long total = state.totalTiles();
    long downloaded = state.downloadedTiles();
    double percent = total > 0 ? round1(downloaded * 100d / total) : 0;
    Duration elapsed = Duration.between(state.startTime(), now);
    if (elapsed.isNegative()) {
      elapsed = Duration.ZERO;
    }
    double elapsedSeconds = elapsed.toNanos() / 1e9;
    double rate = downloaded > 0 && elapsedSeconds > 0 ? downloaded / elapsedSeconds : 0;
    Duration remaining = rate > 0 ?
      Duration.ofMillis(Math.round(Math.max(0, total - downloaded) / rate * 1000)) :
      Duration.ZERO;
    Duration age = Duration.between(state.lastUpdateTime(), now);
    if (age.isNegative()) {
      age = Duration.ZERO;
    }
    return new ProgressSnapshot(state, percent, elapsed, round1(rate), remaining, age);
  }

  private static double round1(double value) {
    return Math.round(value * 10) / 10d;
  }

  public DownloadStatus status() {
    return state.status();
  }

  public long downloadedTiles() {
    return state.downloadedTiles();
  }

  public long totalTiles() {
    return state.totalTiles();
  }

  @JsonProperty("total_tiles")
  long jsonTotalTiles() {
    return state.totalTiles();
  }

  @JsonProperty("downloaded_tiles")
  long jsonDownloadedTiles() {
    return state.downloadedTiles();
  }

  @JsonProperty("current_zoom")
  int jsonCurrentZoom() {
    return state.currentZoom();
  }

  @JsonProperty("status")
  DownloadStatus jsonStatus() {
    return state.status();
  }

  @JsonProperty("error")
  String jsonError() {
    return state.error();
  }

  @JsonProperty("start_time")
  double jsonStartTime() {
    return state.startTime().toEpochMilli() / 1000d;
  }

  @JsonProperty("last_update")
  double jsonLastUpdate() {
    return state.lastUpdateTime().toEpochMilli() / 1000d;
  }

  @JsonProperty("output_file")
  String jsonOutputFile() {
    return state.outputPath() == null ? null : state.outputPath().toString();
  }

  @JsonProperty("display_name")
  String jsonDisplayName() {
    return state.displayName();
  }

  @JsonProperty("file_size_bytes")
  long jsonFileSizeBytes() {
    return state.fileSizeBytes();
  }

  @JsonProperty("tiles_per_zoom")
  Map<Integer, Long> jsonTilesPerZoom() {
    return state.tilesPerZoom();
  }

  @JsonProperty("elapsed_time")
  long jsonElapsedSeconds() {
    return Math.round(elapsed.toMillis() / 1000d);
  }

  @JsonProperty("estimated_remaining_time")
  long jsonEstimatedRemainingSeconds() {
    return Math.round(estimatedRemaining.toMillis() / 1000d);
  }

  @JsonProperty("last_update_ago")
  long jsonLastUpdateAgoSeconds() {
    return Math.round(lastUpdateAge.toMillis() / 1000d);
  }

  /** Returns this snapshot as the JSON object a status endpoint responds with. */
  public String toJson() {
    return JsonUtils.toJsonString(this);
  }
}
