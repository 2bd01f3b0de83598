package com.slack.sqlog.stream;

import com.google.common.base.Preconditions;
import com.slack.sqlog.time.TimeRange;
import com.slack.sqlog.time.TimeSelector;
import com.slack.sqlog.time.TimeWindowException;
import com.slack.sqlog.time.TimeWindowResolver;
import com.slack.sqlog.transport.LogsTransport;
import com.slack.sqlog.transport.TransportException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream mode: one filtered fetch of raw events in the selected window. Whatever order the
 * backend returns, callers always get events newest first. Failures are reported once, there are
 * no retries.
 */
public class StreamFetcher {
  private static final Logger LOG = LoggerFactory.getLogger(StreamFetcher.class);

  public static final String STREAM_FETCHES = "sqlog_stream_fetches";
  public static final String STREAM_FAILURES = "sqlog_stream_failures";
  public static final String STREAM_EVENTS = "sqlog_stream_events";

  private final LogsTransport transport;
  private final TimeWindowResolver timeWindowResolver;
  private final Counter fetches;
  private final Counter failures;
  private final DistributionSummary eventsPerFetch;

  public StreamFetcher(
      LogsTransport transport, TimeWindowResolver timeWindowResolver, MeterRegistry meterRegistry) {
    this.transport = transport;
    this.timeWindowResolver = timeWindowResolver;
    this.fetches = meterRegistry.counter(STREAM_FETCHES);
    this.failures = meterRegistry.counter(STREAM_FAILURES);
    this.eventsPerFetch = meterRegistry.summary(STREAM_EVENTS);
  }

  /**
   * @param pattern backend filter pattern; null or blank fetches everything
   * @param nowEpochMs the current time, used to resolve relative windows
   */
  public List<LogEvent> fetchStream(
      String source, String pattern, TimeSelector selector, int limit, long nowEpochMs)
      throws FetchException {
    Preconditions.checkArgument(StringUtils.isNotEmpty(source), "source is required");
    Preconditions.checkArgument(limit > 0, "limit must be positive, got %s", limit);
    fetches.increment();

    TimeRange range;
    try {
      range = timeWindowResolver.resolve(selector, nowEpochMs);
    } catch (TimeWindowException e) {
      failures.increment();
      throw new FetchException(FetchException.Reason.INVALID_TIME_RANGE, e.getMessage(), e);
    }

    String filterPattern = StringUtils.isBlank(pattern) ? null : pattern;
    List<LogEvent> events;
    try {
      events =
          new ArrayList<>(
              transport.filterEvents(
                  source, filterPattern, range.startEpochMs(), range.endEpochMs(), limit));
    } catch (TransportException e) {
      failures.increment();
      LOG.warn("Fetching events from {} failed: {}", source, e.getMessage());
      throw new FetchException(FetchException.Reason.UPSTREAM, e.getMessage(), e);
    }

    events.sort(LogEvent.NEWEST_FIRST);
    eventsPerFetch.record(events.size());
    LOG.info(
        "Fetched {} events from {} between {} and {}",
        events.size(),
        source,
        range.startEpochMs(),
        range.endEpochMs());
    return events;
  }

  /**
   * Runs {@link #fetchStream} on the given executor. The future fails with a {@link
   * CompletionException} wrapping the {@link FetchException}.
   */
  public CompletableFuture<List<LogEvent>> fetchStreamAsync(
      String source,
      String pattern,
      TimeSelector selector,
      int limit,
      long nowEpochMs,
      Executor executor) {
    return CompletableFuture.supplyAsync(
        () -> {
          try {
            return fetchStream(source, pattern, selector, limit, nowEpochMs);
          } catch (FetchException e) {
            throw new CompletionException(e);
          }
        },
        executor);
  }
}
