package com.slack.sqlog.transport;

import com.google.common.base.Preconditions;
import java.util.List;

/**
 * A single observation of a query job. {@code rows} is null until the backend has results to
 * report; each row is a list of field/value pairs and rows need not share the same fields.
 */
public record JobPollResult(JobStatus status, List<List<ResultField>> rows) {
  public JobPollResult {
    Preconditions.checkNotNull(status, "status can't be null");
  }

  public static JobPollResult of(JobStatus status) {
    return new JobPollResult(status, null);
  }

  public static JobPollResult complete(List<List<ResultField>> rows) {
    return new JobPollResult(JobStatus.COMPLETE, rows);
  }
}
