package com.slack.sqlog.time;

import com.google.common.base.Preconditions;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Turns a {@link TimeSelector} into a concrete {@link TimeRange}. The current time is always
 * passed in, so resolution is deterministic and never reads a clock. Custom bounds are wall-clock
 * strings interpreted in the configured zone.
 */
public class TimeWindowResolver {

  private final ZoneId zoneId;

  public TimeWindowResolver(ZoneId zoneId) {
    Preconditions.checkNotNull(zoneId, "zoneId can't be null");
    this.zoneId = zoneId;
  }

  public ZoneId getZoneId() {
    return zoneId;
  }

  public TimeRange resolve(TimeSelector selector, long nowEpochMs) throws TimeWindowException {
    Preconditions.checkNotNull(selector, "selector can't be null");

    if (selector instanceof TimeSelector.Relative relative) {
      return new TimeRange(nowEpochMs - relative.window().durationMs(), nowEpochMs);
    } else if (selector instanceof TimeSelector.AllTime) {
      return new TimeRange(0, nowEpochMs);
    } else if (selector instanceof TimeSelector.Custom custom) {
      long start = toEpochMs(custom.startLocal(), "start");
      long end = toEpochMs(custom.endLocal(), "end");
      if (start > end) {
        throw new TimeWindowException(
            TimeWindowException.Reason.INVERTED_RANGE,
            String.format(
                "Start time %s is after end time %s", custom.startLocal(), custom.endLocal()));
      }
      return new TimeRange(start, end);
    }
    throw new IllegalArgumentException("Unsupported time selector " + selector);
  }

  private long toEpochMs(String localDateTime, String bound) throws TimeWindowException {
    if (localDateTime == null || localDateTime.isBlank()) {
      throw new TimeWindowException(
          TimeWindowException.Reason.INVALID_TIMESTAMP, "Missing custom " + bound + " time");
    }
    try {
      return LocalDateTime.parse(localDateTime.trim(), DateTimeFormatter.ISO_LOCAL_DATE_TIME)
          .atZone(zoneId)
          .toInstant()
          .toEpochMilli();
    } catch (DateTimeException | ArithmeticException e) {
      // parseable dates outside the epoch millisecond range end up here too
      throw new TimeWindowException(
          TimeWindowException.Reason.INVALID_TIMESTAMP,
          String.format("Invalid custom %s time '%s'", bound, localDateTime),
          e);
    }
  }
}
