package com.slack.sqlog.time;

/** Thrown when a custom time selector can't be turned into a valid range. */
public class TimeWindowException extends Exception {

  public enum Reason {
    INVALID_TIMESTAMP,
    INVERTED_RANGE
  }

  private final Reason reason;

  public TimeWindowException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TimeWindowException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
