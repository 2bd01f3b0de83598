package com.slack.sqlog.time;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The operator's choice of time window. One of {@link Relative}, {@link AllTime} or {@link
 * Custom}; resolved into a concrete {@link TimeRange} by {@link TimeWindowResolver}.
 */
public interface TimeSelector {

  String MODE_ALL = "all";
  String MODE_CUSTOM = "custom";

  /** A look-back window ending at "now". */
  record Relative(RelativeWindow window) implements TimeSelector {
    public Relative {
      Preconditions.checkNotNull(window, "window can't be null");
    }
  }

  /** Everything from the epoch up to "now". */
  record AllTime() implements TimeSelector {}

  /**
   * Wall-clock bounds in the operator's local time, minute precision (e.g. {@code
   * 2024-01-02T10:00}). The strings are only parsed when resolved.
   */
  record Custom(String startLocal, String endLocal) implements TimeSelector {}

  static TimeSelector lastHour() {
    return new Relative(RelativeWindow.ONE_HOUR);
  }

  /**
   * Maps the selector values used by the explorer UI ({@code 1h}, {@code 6h}, {@code 24h}, {@code
   * all}, {@code custom}). An unrecognised relative mode falls back to the last hour.
   */
  static TimeSelector fromMode(String mode, String customStart, String customEnd) {
    if (mode == null || mode.isBlank()) {
      return lastHour();
    }
    String normalized = mode.trim();
    if (MODE_ALL.equalsIgnoreCase(normalized)) {
      return new AllTime();
    }
    if (MODE_CUSTOM.equalsIgnoreCase(normalized)) {
      return new Custom(customStart, customEnd);
    }
    return RelativeWindow.fromLabel(normalized)
        .<TimeSelector>map(Relative::new)
        .orElseGet(
            () -> {
              Logger log = LoggerFactory.getLogger(TimeSelector.class);
              log.warn("Unknown time mode '{}', defaulting to the last hour", mode);
              return lastHour();
            });
  }
}
