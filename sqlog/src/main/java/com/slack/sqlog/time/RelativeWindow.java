package com.slack.sqlog.time;

import java.time.Duration;
import java.util.Optional;

/** The fixed look-back windows offered by the time selector. */
public enum RelativeWindow {
  ONE_HOUR("1h", Duration.ofHours(1)),
  SIX_HOURS("6h", Duration.ofHours(6)),
  TWENTY_FOUR_HOURS("24h", Duration.ofHours(24));

  public final String label;
  public final Duration duration;

  RelativeWindow(String label, Duration duration) {
    this.label = label;
    this.duration = duration;
  }

  public long durationMs() {
    return duration.toMillis();
  }

  public static Optional<RelativeWindow> fromLabel(String label) {
    for (RelativeWindow window : values()) {
      if (window.label.equalsIgnoreCase(label)) {
        return Optional.of(window);
      }
    }
    return Optional.empty();
  }
}
