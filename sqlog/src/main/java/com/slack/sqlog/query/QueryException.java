package com.slack.sqlog.query;

import com.slack.sqlog.transport.JobStatus;

/** A query mode request that did not produce rows. */
public class QueryException extends Exception {

  public enum Reason {
    INVALID_TIME_RANGE,
    SUBMIT_FAILED,
    POLL_FAILED,
    JOB_FAILED,
    TIMED_OUT,
    ABANDONED
  }

  private final Reason reason;
  private final JobStatus jobStatus;

  public QueryException(Reason reason, String message) {
    this(reason, message, null, null);
  }

  public QueryException(Reason reason, String message, Throwable cause) {
    this(reason, message, null, cause);
  }

  private QueryException(Reason reason, String message, JobStatus jobStatus, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.jobStatus = jobStatus;
  }

  public static QueryException jobFailed(String jobId, JobStatus status) {
    return new QueryException(
        Reason.JOB_FAILED,
        String.format("Query %s ended with status %s", jobId, status),
        status,
        null);
  }

  public Reason getReason() {
    return reason;
  }

  /** The terminal status reported by the backend, only set for {@link Reason#JOB_FAILED}. */
  public JobStatus getJobStatus() {
    return jobStatus;
  }
}
