package com.slack.sqlog.transport;

import com.google.common.collect.ImmutableList;
import com.slack.sqlog.stream.LogEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link LogsTransport} over events held in memory, used for the demo mode and in tests. Filter
 * patterns are matched as plain substrings. A submitted query reports {@code RUNNING} for the
 * configured number of polls and then completes with one row per event in its window, newest
 * first, shaped like an Insights result ({@code @timestamp}, {@code @message}, {@code @ptr}). The
 * pipeline text itself is not evaluated.
 */
public class InMemoryLogsTransport implements LogsTransport {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryLogsTransport.class);

  public static final int MAX_QUERY_ROWS = 10_000;
  public static final int MAX_RECORDED_QUERIES = 1_000;

  private static final DateTimeFormatter RESULT_TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

  private static final List<String> MOCK_MESSAGES =
      List.of(
          "[INFO] Request received for handler",
          "[WARN] Deprecated API usage detected",
          "{\"level\":\"info\",\"service\":\"payment\",\"msg\":\"Transaction completed\","
              + "\"amount\":45.00,\"currency\":\"USD\"}",
          "[ERROR] Connection timeout waiting for DB",
          "START RequestId: 890-123 Version: $LATEST",
          "END RequestId: 890-123",
          "REPORT RequestId: 890-123 Duration: 100ms Billed Duration: 100ms Memory Size: 128MB"
              + " Max Memory Used: 68MB");

  private record Job(String source, String query, long startEpochSec, long endEpochSec) {}

  private final Map<String, List<LogEvent>> eventsBySource = new ConcurrentHashMap<>();
  private final Map<String, Job> jobs = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> pollCounts = new ConcurrentHashMap<>();
  private final List<String> submittedQueries = new CopyOnWriteArrayList<>();
  private final int runningPolls;

  public InMemoryLogsTransport(int runningPolls) {
    this.runningPolls = runningPolls;
  }

  public InMemoryLogsTransport() {
    this(1);
  }

  /** A transport with {@code count} events per source, one a minute going back from now. */
  public static InMemoryLogsTransport withMockEvents(
      Clock clock, Collection<String> sources, int count) {
    InMemoryLogsTransport transport = new InMemoryLogsTransport();
    long now = clock.millis();
    for (String source : sources) {
      List<LogEvent> events = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        events.add(
            new LogEvent(
                source + "-" + i,
                now - i * 60_000L,
                MOCK_MESSAGES.get(i % MOCK_MESSAGES.size()),
                now));
      }
      transport.addEvents(source, events);
    }
    return transport;
  }

  public void addEvents(String source, Collection<LogEvent> events) {
    eventsBySource.computeIfAbsent(source, s -> new CopyOnWriteArrayList<>()).addAll(events);
  }

  /** Pipeline text of the most recently submitted queries, in submission order. */
  public List<String> getSubmittedQueries() {
    return ImmutableList.copyOf(submittedQueries);
  }

  @Override
  public List<LogEvent> filterEvents(
      String source, String pattern, long startEpochMs, long endEpochMs, int limit) {
    // Returned oldest first, like a backend scanning forward through time
    return eventsBySource.getOrDefault(source, List.of()).stream()
        .filter(e -> e.timestampMs() >= startEpochMs && e.timestampMs() <= endEpochMs)
        .filter(e -> pattern == null || pattern.isEmpty() || e.message().contains(pattern))
        .sorted(Comparator.comparingLong(LogEvent::timestampMs))
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public String submitQuery(
      String source, String pipelineQuery, long startEpochSec, long endEpochSec) {
    if (!eventsBySource.containsKey(source)) {
      throw new TransportException("Log group " + source + " does not exist");
    }
    String jobId = UUID.randomUUID().toString();
    jobs.put(jobId, new Job(source, pipelineQuery, startEpochSec, endEpochSec));
    pollCounts.put(jobId, new AtomicInteger());
    submittedQueries.add(pipelineQuery);
    while (submittedQueries.size() > MAX_RECORDED_QUERIES) {
      submittedQueries.remove(0);
    }
    LOG.debug("Accepted job {} for {}: {}", jobId, source, pipelineQuery);
    return jobId;
  }

  @Override
  public JobPollResult pollQuery(String jobId) {
    Job job = jobs.get(jobId);
    if (job == null) {
      throw new TransportException("Unknown query id " + jobId);
    }
    if (pollCounts.get(jobId).getAndIncrement() < runningPolls) {
      return JobPollResult.of(JobStatus.RUNNING);
    }

    long startMs = job.startEpochSec() * 1000;
    long endMs = job.endEpochSec() * 1000 + 999;
    List<List<ResultField>> rows =
        eventsBySource.getOrDefault(job.source(), List.of()).stream()
            .filter(e -> e.timestampMs() >= startMs && e.timestampMs() <= endMs)
            .sorted(LogEvent.NEWEST_FIRST)
            .limit(MAX_QUERY_ROWS)
            .map(
                e ->
                    List.of(
                        new ResultField(
                            "@timestamp",
                            RESULT_TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(e.timestampMs()))),
                        new ResultField("@message", e.message()),
                        new ResultField("@ptr", e.eventId())))
            .collect(Collectors.toList());
    // a finished job is forgotten, polling it again fails like any unknown id
    jobs.remove(jobId);
    pollCounts.remove(jobId);
    return JobPollResult.complete(rows);
  }
}
