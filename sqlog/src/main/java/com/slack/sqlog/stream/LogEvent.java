package com.slack.sqlog.stream;

import java.util.Comparator;

/** A raw log line returned in stream mode. */
public record LogEvent(String eventId, long timestampMs, String message, long ingestionTimeMs) {

  public static final Comparator<LogEvent> NEWEST_FIRST =
      Comparator.comparingLong(LogEvent::timestampMs).reversed();
}
