package com.slack.sqlog.transport;

import com.google.common.annotations.VisibleForTesting;
import com.slack.sqlog.stream.LogEvent;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilterLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilterLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilteredLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.GetQueryResultsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.GetQueryResultsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.QueryStatus;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartQueryRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartQueryResponse;

/**
 * {@link LogsTransport} backed by CloudWatch Logs: FilterLogEvents for stream mode, StartQuery and
 * GetQueryResults for Logs Insights queries. A log group name is the source.
 */
public class CloudWatchLogsTransport implements LogsTransport {
  private static final Logger LOG = LoggerFactory.getLogger(CloudWatchLogsTransport.class);

  private final CloudWatchLogsClient client;
  private final Clock clock;

  public CloudWatchLogsTransport(CloudWatchLogsClient client, Clock clock) {
    this.client = client;
    this.clock = clock;
  }

  @Override
  public List<LogEvent> filterEvents(
      String source, String pattern, long startEpochMs, long endEpochMs, int limit) {
    FilterLogEventsRequest.Builder request =
        FilterLogEventsRequest.builder()
            .logGroupName(source)
            .startTime(startEpochMs)
            .endTime(endEpochMs)
            .limit(limit);
    if (pattern != null && !pattern.isEmpty()) {
      request.filterPattern(pattern);
    }

    FilterLogEventsResponse response;
    try {
      response = client.filterLogEvents(request.build());
    } catch (SdkException e) {
      throw new TransportException(e.getMessage(), e);
    }
    LOG.debug("FilterLogEvents on {} returned {} events", source, response.events().size());
    return response.events().stream().map(this::toLogEvent).collect(Collectors.toList());
  }

  // Missing ids and messages become empty strings, missing times become now.
  private LogEvent toLogEvent(FilteredLogEvent event) {
    long now = clock.millis();
    return new LogEvent(
        event.eventId() == null ? "" : event.eventId(),
        event.timestamp() == null ? now : event.timestamp(),
        event.message() == null ? "" : event.message(),
        event.ingestionTime() == null ? now : event.ingestionTime());
  }

  @Override
  public String submitQuery(
      String source, String pipelineQuery, long startEpochSec, long endEpochSec) {
    StartQueryResponse response;
    try {
      response =
          client.startQuery(
              StartQueryRequest.builder()
                  .logGroupNames(source)
                  .queryString(pipelineQuery)
                  .startTime(startEpochSec)
                  .endTime(endEpochSec)
                  .build());
    } catch (SdkException e) {
      throw new TransportException(e.getMessage(), e);
    }
    if (response.queryId() == null || response.queryId().isEmpty()) {
      throw new TransportException("Failed to start query");
    }
    return response.queryId();
  }

  @Override
  public JobPollResult pollQuery(String jobId) {
    GetQueryResultsResponse response;
    try {
      response = client.getQueryResults(GetQueryResultsRequest.builder().queryId(jobId).build());
    } catch (SdkException e) {
      throw new TransportException(e.getMessage(), e);
    }

    JobStatus status = toJobStatus(response.status());
    if (!response.hasResults()) {
      return JobPollResult.of(status);
    }
    List<List<ResultField>> rows =
        response.results().stream()
            .map(
                row ->
                    row.stream()
                        .map(field -> new ResultField(field.field(), field.value()))
                        .collect(Collectors.toList()))
            .collect(Collectors.toList());
    return new JobPollResult(status, rows);
  }

  @VisibleForTesting
  static JobStatus toJobStatus(QueryStatus status) {
    if (status == null) {
      return JobStatus.UNKNOWN;
    }
    switch (status) {
      case SCHEDULED:
        return JobStatus.SCHEDULED;
      case RUNNING:
        return JobStatus.RUNNING;
      case COMPLETE:
        return JobStatus.COMPLETE;
      case FAILED:
        return JobStatus.FAILED;
      case CANCELLED:
        return JobStatus.CANCELLED;
      case TIMEOUT:
        return JobStatus.TIMEOUT;
      default:
        return JobStatus.UNKNOWN;
    }
  }
}
