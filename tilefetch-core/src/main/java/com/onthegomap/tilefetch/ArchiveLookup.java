package com.onthegomap.tilefetch;

import com.onthegomap.tilefetch.stats.DownloadStatus;
import java.nio.file.Path;

/**
 * Result of asking for the archive a download session produced.
 */
public sealed interface ArchiveLookup {

  /** The session completed and its archive is on disk at {@code path}. */
  record Ready(Path path, String displayName, long sizeBytes) implements ArchiveLookup {}

  /** The session exists but has no archive to hand out, yet or ever. */
  record NotReady(DownloadStatus status, String error) implements ArchiveLookup {}

  /** No session with this id is known. */
  record NotFound(String sessionId) implements ArchiveLookup {}
}
