package com.slack.sqlog.time;

import com.google.common.base.Preconditions;

/** A resolved, inclusive window in epoch milliseconds. */
public record TimeRange(long startEpochMs, long endEpochMs) {
  public TimeRange {
    Preconditions.checkArgument(
        startEpochMs <= endEpochMs,
        "start %s must not be after end %s",
        startEpochMs,
        endEpochMs);
  }

  // The analytics backend takes second resolution bounds.
  public long startEpochSeconds() {
    return startEpochMs / 1000;
  }

  public long endEpochSeconds() {
    return endEpochMs / 1000;
  }

  public long durationMs() {
    return endEpochMs - startEpochMs;
  }
}
