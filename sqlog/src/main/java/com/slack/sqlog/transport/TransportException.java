package com.slack.sqlog.transport;

/** A failed call to the log backend. The message is shown to operators as is. */
public class TransportException extends RuntimeException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
