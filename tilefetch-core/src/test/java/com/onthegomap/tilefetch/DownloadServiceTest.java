package com.onthegomap.tilefetch;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.tilefetch.config.Arguments;
import com.onthegomap.tilefetch.config.TileFetchConfig;
import com.onthegomap.tilefetch.fetch.TileFetcher;
import com.onthegomap.tilefetch.geo.TileExtents;
import com.onthegomap.tilefetch.mbtiles.Mbtiles;
import com.onthegomap.tilefetch.stats.DownloadStatus;
import com.onthegomap.tilefetch.stats.MutableClock;
import com.onthegomap.tilefetch.stats.ProgressTracker;
import com.onthegomap.tilefetch.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(60)
class DownloadServiceTest {

  private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000);
  private static final Duration LOG_INTERVAL = Duration.ofMillis(50);
  private static final DownloadRequest BANGALORE = new DownloadRequest(12.9716, 77.5946, 0.005, 10, 11, "bangalore");

  @TempDir
  Path tmpDir;

  private final ProgressTracker tracker = new ProgressTracker(new MutableClock(NOW));
  private DownloadService service;

  @AfterEach
  void close() {
    if (service != null) {
      service.close();
    }
  }

  private TileFetchConfig config() {
    return TileFetchConfig.from(Arguments.of(
      "tile_url", "http://localhost/tiles/{z}/{x}/{y}",
      "request_delay", "0s",
      "output_dir", tmpDir.toString()
    ));
  }

  private DownloadService service(TileFetcher fetcher) {
    service = new DownloadService(config(), fetcher, tracker);
    return service;
  }

  @Test
  void testEndToEnd() throws Exception {
    var service = service(FakeTileFetcher.allOk(config()));
    var extents = service.estimate(BANGALORE);
    var z10 = TileExtents.forZoom(BANGALORE.bounds(), 10);
    var z11 = TileExtents.forZoom(BANGALORE.bounds(), 11);
    assertEquals(z10.count() + z11.count(), extents.totalTiles());

    String session = service.startDownload(BANGALORE);
    assertTrue(session.startsWith("session_1700000000_"), session);
    var result = service.awaitAndLog(session, LOG_INTERVAL);

    assertEquals(DownloadStatus.COMPLETED, result.status());
    var progress = service.getProgress(session).orElseThrow();
    assertEquals(DownloadStatus.COMPLETED, progress.status());
    assertEquals(extents.totalTiles(), progress.totalTiles());
    assertEquals(extents.totalTiles(), progress.downloadedTiles());
    assertEquals(100.0, progress.progressPercent());

    var lookup = assertInstanceOf(ArchiveLookup.Ready.class, service.getArchivePath(session));
    assertEquals(tmpDir.resolve("bangalore.mbtiles"), lookup.path());
    assertEquals("bangalore.mbtiles", lookup.displayName());
    assertEquals(Files.size(lookup.path()), lookup.sizeBytes());
    try (Mbtiles db = Mbtiles.newReadOnlyDatabase(lookup.path())) {
      assertEquals(extents.totalTiles(), db.tileCount());
    }
  }

  @Test
  void testObservesEachState() throws Exception {
    CountDownLatch fetching = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    var fetcher = new FakeTileFetcher(config(), coord -> {
      fetching.countDown();
      try {
        release.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return new TileFetcher.TileResponse(200, FakeTileFetcher.PNG);
    });
    var service = service(fetcher);
    String session = service.startDownload(BANGALORE);
    var first = service.getProgress(session).orElseThrow().status();
    assertTrue(first == DownloadStatus.IDLE || first == DownloadStatus.DOWNLOADING, first.toString());
    assertInstanceOf(ArchiveLookup.NotReady.class, service.getArchivePath(session));

    assertTrue(fetching.await(10, TimeUnit.SECONDS));
    var downloading = service.getProgress(session).orElseThrow();
    assertEquals(DownloadStatus.DOWNLOADING, downloading.status());
    assertEquals(0, downloading.downloadedTiles());
    var notReady = assertInstanceOf(ArchiveLookup.NotReady.class, service.getArchivePath(session));
    assertEquals(DownloadStatus.DOWNLOADING, notReady.status());

    release.countDown();
    assertEquals(DownloadStatus.COMPLETED, service.awaitAndLog(session, LOG_INTERVAL).status());
  }

  @Test
  void testAllTilesMissing() throws Exception {
    var service = service(FakeTileFetcher.allMissing(config()));
    String session = service.startDownload(BANGALORE);
    var result = service.awaitAndLog(session, LOG_INTERVAL);

    assertEquals(DownloadStatus.ERROR, result.status());
    assertEquals(DownloadOrchestrator.NO_TILES_MESSAGE, result.error());
    var lookup = assertInstanceOf(ArchiveLookup.NotReady.class, service.getArchivePath(session));
    assertEquals(DownloadStatus.ERROR, lookup.status());
    assertEquals(DownloadOrchestrator.NO_TILES_MESSAGE, lookup.error());
    assertFalse(Files.exists(tmpDir.resolve("bangalore.mbtiles")));
  }

  @Test
  void testUnknownSession() {
    var service = service(FakeTileFetcher.allOk(config()));
    assertTrue(service.getProgress("session_0_0").isEmpty());
    var lookup = assertInstanceOf(ArchiveLookup.NotFound.class, service.getArchivePath("session_0_0"));
    assertEquals("session_0_0", lookup.sessionId());
    assertThrows(IllegalArgumentException.class, () -> service.awaitAndLog("session_0_0", LOG_INTERVAL));
  }

  @Test
  void testArchiveDeletedAfterCompletion() throws Exception {
    var service = service(FakeTileFetcher.allOk(config()));
    String session = service.startDownload(BANGALORE);
    service.awaitAndLog(session, LOG_INTERVAL);
    Files.delete(tmpDir.resolve("bangalore.mbtiles"));
    var lookup = assertInstanceOf(ArchiveLookup.NotReady.class, service.getArchivePath(session));
    assertEquals(DownloadStatus.COMPLETED, lookup.status());
  }

  @Test
  void testSessionIdsAreUnique() throws Exception {
    var service = service(FakeTileFetcher.allOk(config()));
    String a = service.startDownload(new DownloadRequest(12.9716, 77.5946, 0.005, 10, 10, "a"));
    String b = service.startDownload(new DownloadRequest(12.9716, 77.5946, 0.005, 10, 10, "b"));
    assertNotEquals(a, b);
    assertEquals(2, service.activeSessions());
    assertEquals(DownloadStatus.COMPLETED, service.awaitAndLog(a, LOG_INTERVAL).status());
    assertEquals(DownloadStatus.COMPLETED, service.awaitAndLog(b, LOG_INTERVAL).status());
    assertTrue(Files.exists(tmpDir.resolve("a.mbtiles")));
    assertTrue(Files.exists(tmpDir.resolve("b.mbtiles")));
  }

  @Test
  void testRemoveSession() throws Exception {
    var service = service(FakeTileFetcher.allOk(config()));
    String session = service.startDownload(BANGALORE);
    service.awaitAndLog(session, LOG_INTERVAL);
    assertTrue(service.removeSession(session));
    assertFalse(service.removeSession(session));
    assertTrue(service.getProgress(session).isEmpty());
    assertInstanceOf(ArchiveLookup.NotFound.class, service.getArchivePath(session));
    assertEquals(0, service.activeSessions());
    assertTrue(Files.exists(tmpDir.resolve("bangalore.mbtiles")));
  }

  @Test
  void testCannotRemoveRunningSession() throws Exception {
    CountDownLatch fetching = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    var fetcher = new FakeTileFetcher(config(), coord -> {
      fetching.countDown();
      try {
        release.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return new TileFetcher.TileResponse(200, FakeTileFetcher.PNG);
    });
    var service = service(fetcher);
    String session = service.startDownload(BANGALORE);
    assertTrue(fetching.await(10, TimeUnit.SECONDS));

    assertFalse(service.removeSession(session));
    assertEquals(1, service.activeSessions());
    assertEquals(DownloadStatus.DOWNLOADING, service.getProgress(session).orElseThrow().status());

    release.countDown();
    var result = service.awaitAndLog(session, LOG_INTERVAL);
    assertEquals(DownloadStatus.COMPLETED, result.status());
    var progress = service.getProgress(session).orElseThrow();
    assertEquals(progress.totalTiles(), progress.downloadedTiles());
    assertInstanceOf(ArchiveLookup.Ready.class, service.getArchivePath(session));
    assertTrue(service.removeSession(session));
    assertEquals(0, service.activeSessions());
  }

  @Test
  void testProgressJson() throws Exception {
    var service = service(FakeTileFetcher.allOk(config()));
    String session = service.startDownload(BANGALORE);
    service.awaitAndLog(session, LOG_INTERVAL);
    JsonNode json = JsonUtils.mapper().readTree(service.getProgress(session).orElseThrow().toJson());
    assertEquals("completed", json.get("status").asText());
    assertEquals("bangalore.mbtiles", json.get("display_name").asText());
    assertEquals(tmpDir.resolve("bangalore.mbtiles").toString(), json.get("output_file").asText());
    assertEquals(json.get("total_tiles").asLong(), json.get("downloaded_tiles").asLong());
    assertTrue(json.get("file_size_bytes").asLong() > 0);
  }

  @Test
  void testInvalidRequestCreatesNoSession() {
    var service = service(FakeTileFetcher.allOk(config()));
    assertThrows(IllegalArgumentException.class, () -> new DownloadRequest(91, 0, 0.005, 10, 11));
    assertEquals(0, service.activeSessions());
  }

  @Test
  void testCloseLetsRunningDownloadsFinish() throws Exception {
    var service = service(FakeTileFetcher.allOk(config()));
    String session = service.startDownload(BANGALORE);
    service.close();
    assertEquals(DownloadStatus.COMPLETED, service.awaitAndLog(session, LOG_INTERVAL).status());
  }

  @Test
  void testStartAfterFailureStillWorks() throws IOException, InterruptedException {
    var service = service(FakeTileFetcher.allMissing(config()));
    String failed = service.startDownload(BANGALORE);
    assertEquals(DownloadStatus.ERROR, service.awaitAndLog(failed, LOG_INTERVAL).status());
    var other = new DownloadService(config(), FakeTileFetcher.allOk(config()), tracker);
    try (other) {
      String ok = other.startDownload(BANGALORE);
      assertEquals(DownloadStatus.COMPLETED, other.awaitAndLog(ok, LOG_INTERVAL).status());
      assertEquals(DownloadStatus.ERROR, other.getProgress(failed).orElseThrow().status());
    }
  }
}
