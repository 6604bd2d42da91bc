package com.onthegomap.tilefetch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.onthegomap.tilefetch.config.TileFetchConfig;
import com.onthegomap.tilefetch.fetch.TileFetcher;
import com.onthegomap.tilefetch.geo.TileExtents;
import com.onthegomap.tilefetch.stats.DownloadStatus;
import com.onthegomap.tilefetch.stats.ProgressSnapshot;
import com.onthegomap.tilefetch.stats.ProgressState;
import com.onthegomap.tilefetch.stats.ProgressTracker;
import com.onthegomap.tilefetch.util.Format;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for request handlers: starts download sessions in the background and answers status queries about them.
 * <p>
 * Every session runs on its own thread until it completes or fails. There is no limit on concurrent sessions and no
 * way to cancel one that is running.
 * <p>
 * For example:
 * <pre>{@code
 * try (var service = DownloadService.create(TileFetchConfig.defaults())) {
 *   String session = service.startDownload(new DownloadRequest(12.9716, 77.5946, 0.005, 10, 11, "bangalore"));
 *   service.getProgress(session).ifPresent(progress -> System.out.println(progress.toJson()));
 * }
 * }</pre>
 */
public class DownloadService implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadService.class);
  private static final AtomicLong SESSION_COUNTER = new AtomicLong(0);

  private final ProgressTracker tracker;
  private final DownloadOrchestrator orchestrator;
  private final ExecutorService executor;
  private final ConcurrentMap<String, CompletableFuture<ProgressState>> tasks = new ConcurrentHashMap<>();

  public DownloadService(TileFetchConfig config, TileFetcher fetcher, ProgressTracker tracker) {
    this.tracker = tracker;
    this.orchestrator = new DownloadOrchestrator(config, fetcher, tracker);
    this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
      .setNameFormat("download-%d")
      .setDaemon(true)
      .build());
  }

  public static DownloadService create(TileFetchConfig config) {
    return new DownloadService(config, TileFetcher.create(config), new ProgressTracker());
  }

  /** Returns the tile ranges {@code request} will download, the same ones its session reports progress against. */
  public TileExtents estimate(DownloadRequest request) {
    return TileExtents.compute(request.bounds(), request.minZoom(), request.maxZoom());
  }

  /**
   * Starts downloading tiles for {@code request} in the background and returns immediately.
   *
   * @return ID of the new session to pass to {@link #getProgress(String)} and {@link #getArchivePath(String)}
   */
  public String startDownload(DownloadRequest request) {
    String session = newSessionId();
    tracker.register(session);
    LOGGER.info("Session {}: creating MBTiles for {},{} buffer {} zoom {}-{}, estimated total tiles: {}",
      session, request.lat(), request.lon(), request.buffer(), request.minZoom(), request.maxZoom(),
      estimate(request).totalTiles());
    var task = CompletableFuture.supplyAsync(() -> orchestrator.run(session, request), executor);
    tasks.put(session, task);
    task.thenAccept(state -> LOGGER.info("Session {}: finished with status {}{}", session, state.status().id(),
      state.error() == null ? "" : " - " + state.error()));
    return session;
  }

  private String newSessionId() {
    return "session_" + tracker.clock().instant().getEpochSecond() + "_" + SESSION_COUNTER.incrementAndGet();
  }

  /** Returns the progress of {@code session}, or empty if there is no such session. */
  public Optional<ProgressSnapshot> getProgress(String session) {
    return tracker.snapshot(session);
  }

  /** Returns where the archive for {@code session} is if it completed and the file still exists. */
  public ArchiveLookup getArchivePath(String session) {
    var state = tracker.state(session);
    if (state.isEmpty()) {
      return new ArchiveLookup.NotFound(session);
    }
    var progress = state.get();
    if (progress.status() == DownloadStatus.COMPLETED && progress.outputPath() != null &&
      Files.exists(progress.outputPath())) {
      return new ArchiveLookup.Ready(progress.outputPath(), progress.displayName(), progress.fileSizeBytes());
    }
    return new ArchiveLookup.NotReady(progress.status(), progress.error());
  }

  /**
   * Stops tracking a finished {@code session}, leaving its archive on disk.
   *
   * @return false if there is no such session or it is still running
   */
  public boolean removeSession(String session) {
    if (!tracker.remove(session)) {
      return false;
    }
    tasks.remove(session);
    return true;
  }

  /** Number of sessions being tracked, finished or not. */
  public int activeSessions() {
    return tracker.activeSessions();
  }

  /**
   * Blocks until {@code session} finishes, logging progress every {@code logInterval}.
   *
   * @return the final state of the session
   * @throws IllegalArgumentException if the session was not started by this service
   */
  public ProgressState awaitAndLog(String session, Duration logInterval) throws InterruptedException {
    var task = tasks.get(session);
    if (task == null) {
      throw new IllegalArgumentException("Unknown session " + session);
    }
    var format = Format.defaultInstance();
    while (true) {
      try {
        return task.get(logInterval.toNanos(), TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        tracker.snapshot(session).ifPresent(progress -> LOGGER.info("Session {}: {} {}/{} tiles z{} {}/s eta {}",
          session, format.percent(progress.progressPercent() / 100),
          format.integer(progress.downloadedTiles()), format.integer(progress.totalTiles()),
          progress.state().currentZoom(), format.decimal(progress.tilesPerSecond()),
          format.duration(progress.estimatedRemaining())));
      } catch (ExecutionException e) {
        throw new IllegalStateException("Download task for " + session + " failed", e.getCause());
      }
    }
  }

  /** Stops accepting new downloads, sessions already running continue until they finish. */
  @Override
  public void close() {
    executor.shutdown();
  }
}
