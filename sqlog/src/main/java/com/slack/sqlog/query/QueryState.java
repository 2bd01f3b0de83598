package com.slack.sqlog.query;

/** Where a query execution is in its lifecycle. */
public enum QueryState {
  SUBMITTING,
  POLLING,
  COMPLETED,
  FAILED,
  ABANDONED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == ABANDONED;
  }
}
