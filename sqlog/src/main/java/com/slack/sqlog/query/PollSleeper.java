package com.slack.sqlog.query;

import java.time.Duration;

/** Waits between polls of a running query. */
@FunctionalInterface
public interface PollSleeper {

  PollSleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
