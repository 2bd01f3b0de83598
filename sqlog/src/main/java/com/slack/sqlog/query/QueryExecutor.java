package com.slack.sqlog.query;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.slack.sqlog.time.TimeRange;
import com.slack.sqlog.time.TimeSelector;
import com.slack.sqlog.time.TimeWindowException;
import com.slack.sqlog.time.TimeWindowResolver;
import com.slack.sqlog.translate.PipelineQuery;
import com.slack.sqlog.translate.SqlToPipelineTranslator;
import com.slack.sqlog.transport.JobPollResult;
import com.slack.sqlog.transport.JobStatus;
import com.slack.sqlog.transport.LogsTransport;
import com.slack.sqlog.transport.ResultField;
import com.slack.sqlog.transport.TransportException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query mode. A query moves through SUBMITTING (resolve the window, translate the SQL, start the
 * job) and POLLING (one status check per second) until the backend reports a terminal status or
 * the caller abandons it.
 *
 * <p>There is no cap on the number of polls. Callers that need a bound use {@link
 * QueryHandle#get(Duration)} or {@link QueryHandle#cancel()}; either stops polling, though the
 * remote job is left to run.
 */
public class QueryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(QueryExecutor.class);

  public static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

  public static final String QUERIES_SUBMITTED = "sqlog_queries_submitted";
  public static final String QUERIES_COMPLETED = "sqlog_queries_completed";
  public static final String QUERIES_FAILED = "sqlog_queries_failed";
  public static final String QUERIES_ABANDONED = "sqlog_queries_abandoned";
  public static final String QUERY_POLLS = "sqlog_query_polls";
  public static final String QUERY_DURATION = "sqlog_query_duration";

  private final LogsTransport transport;
  private final TimeWindowResolver timeWindowResolver;
  private final SqlToPipelineTranslator translator;
  private final ExecutorService executorService;
  private final PollSleeper sleeper;

  private final MeterRegistry meterRegistry;
  private final Counter submitted;
  private final Counter completed;
  private final Counter failed;
  private final Counter abandoned;
  private final Counter polls;
  private final Timer duration;

  public QueryExecutor(
      LogsTransport transport,
      TimeWindowResolver timeWindowResolver,
      SqlToPipelineTranslator translator,
      ExecutorService executorService,
      PollSleeper sleeper,
      MeterRegistry meterRegistry) {
    this.transport = transport;
    this.timeWindowResolver = timeWindowResolver;
    this.translator = translator;
    this.executorService = executorService;
    this.sleeper = sleeper;
    this.meterRegistry = meterRegistry;
    this.submitted = meterRegistry.counter(QUERIES_SUBMITTED);
    this.completed = meterRegistry.counter(QUERIES_COMPLETED);
    this.failed = meterRegistry.counter(QUERIES_FAILED);
    this.abandoned = meterRegistry.counter(QUERIES_ABANDONED);
    this.polls = meterRegistry.counter(QUERY_POLLS);
    this.duration = meterRegistry.timer(QUERY_DURATION);
  }

  /** Runs the query on the executor and returns immediately. */
  public QueryHandle submit(String source, String sql, TimeSelector selector, long nowEpochMs) {
    Preconditions.checkArgument(source != null && !source.isEmpty(), "source is required");
    QueryHandle handle = new QueryHandle();
    handle.attach(executorService.submit(() -> execute(source, sql, selector, nowEpochMs, handle)));
    return handle;
  }

  /**
   * Runs the query on the calling thread. Interrupting the thread abandons the query.
   *
   * @param nowEpochMs the current time, used to resolve relative windows
   */
  public List<ResultRow> runQuery(String source, String sql, TimeSelector selector, long nowEpochMs)
      throws QueryException, InterruptedException {
    Preconditions.checkArgument(source != null && !source.isEmpty(), "source is required");
    QueryHandle handle = new QueryHandle();
    execute(source, sql, selector, nowEpochMs, handle);
    return handle.get();
  }

  private void execute(
      String source, String sql, TimeSelector selector, long nowEpochMs, QueryHandle handle) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<ResultRow> rows = runStateMachine(source, sql, selector, nowEpochMs, handle);
      completed.increment();
      handle.complete(rows);
    } catch (QueryException e) {
      if (e.getReason() == QueryException.Reason.ABANDONED) {
        abandoned.increment();
      } else {
        failed.increment();
      }
      handle.fail(e);
    } catch (RuntimeException e) {
      QueryException wrapped = unexpectedFailure(e, handle);
      if (wrapped.getReason() == QueryException.Reason.ABANDONED) {
        abandoned.increment();
      } else {
        LOG.error("Query {} failed unexpectedly", handle.getJobId(), e);
        failed.increment();
      }
      handle.fail(wrapped);
    } finally {
      sample.stop(duration);
    }
  }

  // The failure is attributed to the phase the query was in when it was thrown.
  private static QueryException unexpectedFailure(RuntimeException e, QueryHandle handle) {
    if (handle.isCancelled()) {
      return new QueryException(QueryException.Reason.ABANDONED, "Query was cancelled", e);
    }
    QueryException.Reason reason =
        handle.getState() == QueryState.SUBMITTING
            ? QueryException.Reason.SUBMIT_FAILED
            : QueryException.Reason.POLL_FAILED;
    return new QueryException(reason, String.valueOf(e.getMessage()), e);
  }

  private List<ResultRow> runStateMachine(
      String source, String sql, TimeSelector selector, long nowEpochMs, QueryHandle handle)
      throws QueryException {
    handle.transition(QueryState.SUBMITTING);

    TimeRange range;
    try {
      range = timeWindowResolver.resolve(selector, nowEpochMs);
    } catch (TimeWindowException e) {
      throw new QueryException(QueryException.Reason.INVALID_TIME_RANGE, e.getMessage(), e);
    }

    PipelineQuery pipeline = translator.translate(sql);
    String pipelineText = pipeline.render();

    String jobId;
    try {
      jobId =
          transport.submitQuery(
              source, pipelineText, range.startEpochSeconds(), range.endEpochSeconds());
    } catch (TransportException e) {
      LOG.warn("Submitting query to {} failed: {}", source, e.getMessage());
      throw new QueryException(QueryException.Reason.SUBMIT_FAILED, e.getMessage(), e);
    }
    submitted.increment();
    handle.setJobId(jobId);
    LOG.info("Submitted query {} to {}: {}", jobId, source, pipelineText);

    handle.transition(QueryState.POLLING);
    while (true) {
      try {
        sleeper.sleep(POLL_INTERVAL);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new QueryException(
            QueryException.Reason.ABANDONED, "Interrupted while polling query " + jobId, e);
      }
      Optional<JobPollResult> polled;
      try {
        polled = handle.pollUnlessCancelled(() -> transport.pollQuery(jobId));
      } catch (TransportException e) {
        if (handle.isCancelled()) {
          throw new QueryException(QueryException.Reason.ABANDONED, "Query was cancelled", e);
        }
        LOG.warn("Polling query {} failed: {}", jobId, e.getMessage());
        throw new QueryException(QueryException.Reason.POLL_FAILED, e.getMessage(), e);
      }
      if (polled.isEmpty()) {
        LOG.info("Stopped polling query {}, the job may still run remotely", jobId);
        throw new QueryException(QueryException.Reason.ABANDONED, "Query was cancelled");
      }
      JobPollResult result = polled.get();
      polls.increment();
      LOG.debug("Query {} status {}", jobId, result.status());

      if (result.status() == JobStatus.COMPLETE) {
        List<ResultRow> rows = shapeRows(result.rows());
        LOG.info("Query {} completed with {} rows", jobId, rows.size());
        return rows;
      }
      if (result.status().isTerminal()) {
        throw QueryException.jobFailed(jobId, result.status());
      }
    }
  }

  /**
   * Turns each backend row into a column map. Every row is shaped on its own since rows of one
   * result can carry different fields. Null fields and fields without a name are dropped, a
   * repeated field keeps its last value, and a missing value becomes an empty string.
   */
  @VisibleForTesting
  static List<ResultRow> shapeRows(List<List<ResultField>> rows) {
    if (rows == null) {
      return List.of();
    }
    List<ResultRow> shaped = new ArrayList<>(rows.size());
    for (List<ResultField> row : rows) {
      Map<String, String> columns = new LinkedHashMap<>();
      if (row == null) {
        shaped.add(new ResultRow(columns));
        continue;
      }
      for (ResultField field : row) {
        if (field == null || field.field() == null || field.field().isEmpty()) {
          continue;
        }
        columns.put(field.field(), field.value() == null ? "" : field.value());
      }
      shaped.add(new ResultRow(columns));
    }
    return shaped;
  }
}
