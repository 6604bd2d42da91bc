package com.onthegomap.tilefetch.stats;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle of a download session: {@code IDLE -> DOWNLOADING -> COMPLETED | ERROR}. */
public enum DownloadStatus {
  IDLE,
  DOWNLOADING,
  COMPLETED,
  ERROR;

  /** Returns true for states a session never leaves once it reaches them. */
  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
