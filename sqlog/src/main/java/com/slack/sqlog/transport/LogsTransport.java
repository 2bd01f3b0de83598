package com.slack.sqlog.transport;

import com.slack.sqlog.stream.LogEvent;
import java.util.List;

/**
 * The network calls the query engine needs from a log backend. Implementations report failures
 * as {@link TransportException} and never retry on their own.
 */
public interface LogsTransport {

  /**
   * Fetches raw events for a source in a millisecond window.
   *
   * @param pattern backend filter pattern, or null for no filtering
   * @return events in no particular order
   */
  List<LogEvent> filterEvents(
      String source, String pattern, long startEpochMs, long endEpochMs, int limit);

  /**
   * Starts an analytics query over a window given in epoch seconds.
   *
   * @return the backend's job id
   */
  String submitQuery(String source, String pipelineQuery, long startEpochSec, long endEpochSec);

  JobPollResult pollQuery(String jobId);
}
