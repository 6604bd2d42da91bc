package com.onthegomap.tilefetch.stats;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide registry of download session progress.
 * <p>
 * Each session holds an immutable {@link ProgressState} that its download thread replaces atomically on every update,
 * so status readers never block the writer and never see a partially-updated record. Sessions are stored in
 * independent entries so updates to different sessions do not contend.
 * <p>
 * Once a session reaches {@link DownloadStatus#COMPLETED} or {@link DownloadStatus#ERROR} it stays there.
 */
@ThreadSafe
public class ProgressTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);

  private final ConcurrentMap<String, AtomicReference<ProgressState>> sessions = new ConcurrentHashMap<>();
  private final Clock clock;

  public ProgressTracker(Clock clock) {
    this.clock = clock;
  }

  public ProgressTracker() {
    this(Clock.systemUTC());
  }

  public Clock clock() {
    return clock;
  }

  /**
   * Registers a new session in the {@link DownloadStatus#IDLE} state.
   *
   * @throws IllegalArgumentException if {@code session} is already registered
   */
  public void register(String session) {
    var previous = sessions.putIfAbsent(session, new AtomicReference<>(ProgressState.idle(clock.instant())));
    if (previous != null) {
      throw new IllegalArgumentException("Session already exists: " + session);
    }
  }

  /** Moves {@code session} to {@link DownloadStatus#DOWNLOADING} with {@code total} tiles to go. */
  public void init(String session, long total, SortedMap<Integer, Long> perZoom, Path outputPath) {
    int firstZoom = perZoom.isEmpty() ? 0 : perZoom.firstKey();
    update(session, "init", state -> state.downloading(total, perZoom, firstZoom, outputPath, clock.instant()));
  }

  /**
   * Records that {@code delta} more tiles were attempted in {@code session} while working on {@code currentZoom}.
   *
   * @throws IllegalArgumentException if {@code delta} is negative
   */
  public void advance(String session, int currentZoom, long delta) {
    if (delta < 0) {
      throw new IllegalArgumentException("Downloaded tiles can only go up, got " + delta);
    }
    update(session, "advance", state -> state.advanced(currentZoom, delta, clock.instant()));
  }

  /** Records that {@code session} started working on {@code zoom}. */
  public void setCurrentZoom(String session, int zoom) {
    advance(session, zoom, 0);
  }

  /**
   * Moves {@code session} to the terminal {@link DownloadStatus#COMPLETED} state.
   *
   * @return the resulting state, or empty if the session is not known
   */
  public Optional<ProgressState> complete(String session, Path outputPath, String displayName, long fileSizeBytes) {
    return update(session, "complete",
      state -> state.completed(outputPath, displayName, fileSizeBytes, clock.instant()));
  }

  /**
   * Moves {@code session} to the terminal {@link DownloadStatus#ERROR} state with {@code message}.
   *
   * @return the resulting state, or empty if the session is not known
   */
  public Optional<ProgressState> fail(String session, String message) {
    return update(session, "fail", state -> state.failed(message, clock.instant()));
  }

  private Optional<ProgressState> update(String session, String operation, UnaryOperator<ProgressState> fn) {
    var ref = sessions.get(session);
    if (ref == null) {
      LOGGER.warn("Ignoring {} for unknown session {}", operation, session);
      return Optional.empty();
    }
    return Optional.of(ref.updateAndGet(state -> {
      if (state.status().isTerminal()) {
        LOGGER.warn("Ignoring {} for session {} which is already {}", operation, session, state.status().id());
        return state;
      }
      return fn.apply(state);
    }));
  }

  /** Returns the current raw state of {@code session}, or empty if it is not known. */
  public Optional<ProgressState> state(String session) {
    var ref = sessions.get(session);
    return ref == null ? Optional.empty() : Optional.of(ref.get());
  }

  /** Returns the current state of {@code session} with derived metrics, or empty if it is not known. */
  public Optional<ProgressSnapshot> snapshot(String session) {
    return state(session).map(state -> ProgressSnapshot.of(state, clock.instant()));
  }

  /**
   * Stops tracking {@code session} once it has completed or failed.
   *
   * @return true if the session was removed, false if it is not known or still in progress
   */
  public boolean remove(String session) {
    var ref = sessions.get(session);
    if (ref == null) {
      return false;
    }
    var status = ref.get().status();
    if (!status.isTerminal()) {
      LOGGER.warn("Not removing session {} which is still {}", session, status.id());
      return false;
    }
    return sessions.remove(session, ref);
  }

  /** Number of sessions currently tracked, in any state. */
  public int activeSessions() {
    return sessions.size();
  }
}
