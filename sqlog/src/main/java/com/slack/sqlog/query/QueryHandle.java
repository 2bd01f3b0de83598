package com.slack.sqlog.query;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A running query. Cancelling stops further polling but does not cancel the job the backend has
 * already accepted; it may keep running remotely.
 */
public class QueryHandle {
  private static final Logger LOG = LoggerFactory.getLogger(QueryHandle.class);

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final AtomicReference<QueryState> state = new AtomicReference<>(QueryState.SUBMITTING);
  private final CompletableFuture<List<ResultRow>> result = new CompletableFuture<>();
  private final Object pollLock = new Object();
  private volatile String jobId;
  private Future<?> task;

  QueryHandle() {}

  synchronized void attach(Future<?> task) {
    this.task = task;
    if (cancelled.get()) {
      task.cancel(true);
    }
  }

  public QueryState getState() {
    return state.get();
  }

  /** The backend job id, null until the query has been accepted. */
  public String getJobId() {
    return jobId;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public boolean isDone() {
    return result.isDone();
  }

  /** Stops polling. Has no effect once the query has finished. */
  public void cancel() {
    abandon(new QueryException(QueryException.Reason.ABANDONED, "Query was cancelled"));
  }

  public List<ResultRow> get() throws QueryException, InterruptedException {
    try {
      return result.get();
    } catch (ExecutionException e) {
      throw unwrap(e);
    }
  }

  /**
   * Waits at most {@code timeout} for the rows. When the deadline passes polling stops and the
   * query fails with {@link QueryException.Reason#TIMED_OUT}.
   */
  public List<ResultRow> get(Duration timeout) throws QueryException, InterruptedException {
    try {
      return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw unwrap(e);
    } catch (TimeoutException e) {
      QueryException timedOut =
          new QueryException(
              QueryException.Reason.TIMED_OUT,
              String.format("Query %s did not finish within %s", jobId, timeout));
      abandon(timedOut);
      return get();
    }
  }

  void setJobId(String jobId) {
    this.jobId = jobId;
  }

  void transition(QueryState next) {
    QueryState previous = state.getAndUpdate(current -> current.isTerminal() ? current : next);
    if (!previous.isTerminal()) {
      LOG.debug("Query {} moved from {} to {}", jobId, previous, next);
    }
  }

  void complete(List<ResultRow> rows) {
    if (result.complete(rows)) {
      transition(QueryState.COMPLETED);
    }
  }

  void fail(QueryException e) {
    if (result.completeExceptionally(e)) {
      transition(
          e.getReason() == QueryException.Reason.ABANDONED
              ? QueryState.ABANDONED
              : QueryState.FAILED);
    }
  }

  /**
   * Runs one poll unless the query has been cancelled. Holding the poll lock while the poll runs
   * means no poll starts after {@link #cancel()} returns; cancelling waits for one in flight.
   *
   * @return empty when the query was cancelled and nothing was polled
   */
  <T> Optional<T> pollUnlessCancelled(Supplier<T> poll) {
    synchronized (pollLock) {
      if (cancelled.get()) {
        return Optional.empty();
      }
      return Optional.of(poll.get());
    }
  }

  private void abandon(QueryException reason) {
    synchronized (pollLock) {
      if (result.isDone()) {
        return;
      }
      cancelled.set(true);
    }
    if (result.completeExceptionally(reason)) {
      transition(QueryState.ABANDONED);
    }
    synchronized (this) {
      if (task != null) {
        task.cancel(true);
      }
    }
  }

  private static QueryException unwrap(ExecutionException e) {
    if (e.getCause() instanceof QueryException queryException) {
      return queryException;
    }
    return new QueryException(QueryException.Reason.POLL_FAILED, e.getMessage(), e.getCause());
  }
}
