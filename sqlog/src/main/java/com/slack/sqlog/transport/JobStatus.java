package com.slack.sqlog.transport;

/** Lifecycle of an asynchronous query job on the analytics backend. */
public enum JobStatus {
  SCHEDULED,
  RUNNING,
  COMPLETE,
  FAILED,
  CANCELLED,
  TIMEOUT,
  UNKNOWN;

  public boolean isTerminal() {
    return this != SCHEDULED && this != RUNNING;
  }
}
