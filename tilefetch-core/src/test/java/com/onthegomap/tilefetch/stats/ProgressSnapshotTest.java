package com.onthegomap.tilefetch.stats;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.tilefetch.util.JsonUtils;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class ProgressSnapshotTest {

  private static final Instant START = Instant.ofEpochSecond(1_700_000_000);

  private static JsonNode parse(String json) throws Exception {
    return JsonUtils.mapper().readTree(json);
  }

  @Test
  void testJsonOfDownloadingSession() throws Exception {
    var perZoom = new TreeMap<Integer, Long>();
    perZoom.put(10, 1L);
    perZoom.put(11, 4L);
    var state = new ProgressState(5, 2, 11, DownloadStatus.DOWNLOADING, null, START, START.plusSeconds(4),
      Path.of("/tmp/city.mbtiles"), null, 0, perZoom);
    var snapshot = ProgressSnapshot.of(state, START.plusSeconds(5));
    JsonNode json = parse(snapshot.toJson());

    assertEquals(5, json.get("total_tiles").asLong());
    assertEquals(2, json.get("downloaded_tiles").asLong());
    assertEquals(11, json.get("current_zoom").asInt());
    assertEquals("downloading", json.get("status").asText());
    assertEquals(40.0, json.get("progress_percent").asDouble());
    assertEquals(0.4, json.get("tiles_per_second").asDouble());
    assertEquals(5, json.get("elapsed_time").asLong());
    assertEquals(8, json.get("estimated_remaining_time").asLong());
    assertEquals(1, json.get("last_update_ago").asLong());
    assertEquals(1_700_000_000d, json.get("start_time").asDouble());
    assertEquals(1_700_000_004d, json.get("last_update").asDouble());
    assertEquals("/tmp/city.mbtiles", json.get("output_file").asText());
    assertEquals(1, json.get("tiles_per_zoom").get("10").asLong());
    assertEquals(4, json.get("tiles_per_zoom").get("11").asLong());
    assertFalse(json.has("error"));
    assertFalse(json.has("state"));
    assertFalse(json.has("elapsed"));
  }

  @Test
  void testJsonOfFailedSession() throws Exception {
    var state = new ProgressState(5, 5, 11, DownloadStatus.ERROR, "No tiles were successfully downloaded", START,
      START, null, null, 0, new TreeMap<>());
    JsonNode json = parse(ProgressSnapshot.of(state, START).toJson());
    assertEquals("error", json.get("status").asText());
    assertEquals("No tiles were successfully downloaded", json.get("error").asText());
    assertFalse(json.has("output_file"));
  }

  @Test
  void testJsonKeys() throws Exception {
    var state = ProgressState.idle(START);
    JsonNode json = parse(ProgressSnapshot.of(state, START).toJson());
    Set<String> keys = new java.util.TreeSet<>();
    json.fieldNames().forEachRemaining(keys::add);
    assertEquals(Set.of(
      "total_tiles",
      "downloaded_tiles",
      "current_zoom",
      "status",
      "start_time",
      "last_update",
      "file_size_bytes",
      "tiles_per_zoom",
      "progress_percent",
      "tiles_per_second",
      "elapsed_time",
      "estimated_remaining_time",
      "last_update_ago"
    ), keys);
    assertEquals("idle", json.get("status").asText());
  }

  @Test
  void testClockSkewDoesNotProduceNegativeDurations() {
    var state = ProgressState.idle(START);
    var snapshot = ProgressSnapshot.of(state, START.minusSeconds(5));
    assertEquals(Duration.ZERO, snapshot.elapsed());
    assertEquals(Duration.ZERO, snapshot.lastUpdateAge());
  }
}
