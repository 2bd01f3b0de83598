package com.slack.sqlog.stream;

/** A stream mode fetch that could not be completed. */
public class FetchException extends Exception {

  public enum Reason {
    INVALID_TIME_RANGE,
    UPSTREAM
  }

  private final Reason reason;

  public FetchException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
