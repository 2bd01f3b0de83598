package com.slack.sqlog.server;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.sqlog.config.SqlogConfigs;
import com.slack.sqlog.time.RelativeWindow;
import com.slack.sqlog.time.TimeSelector;
import java.time.DateTimeException;
import java.time.ZoneId;

public class ValidateSqlogConfig {

  public static final int MAX_STREAM_LIMIT = 10_000;

  /**
   * Checks the values that can't be checked by binding alone. Classes using a config are still
   * expected to validate the values they depend on.
   */
  public static void validateConfig(SqlogConfigs.SqlogConfig config) {
    if (config.transport() == SqlogConfigs.TransportType.CLOUDWATCH) {
      validateAwsConfig(config.awsConfig());
    }
    validateQueryConfig(config.queryConfig());
    validateStreamConfig(config.streamConfig());
    validateTimeConfig(config.timeConfig());
  }

  private static void validateAwsConfig(SqlogConfigs.AwsConfig awsConfig) {
    checkArgument(
        awsConfig.region() != null && !awsConfig.region().isEmpty(),
        "AwsConfig region is required for the CLOUDWATCH transport");
    checkArgument(
        (awsConfig.accessKey() == null) == (awsConfig.secretKey() == null),
        "AwsConfig accessKey and secretKey must be set together");
  }

  private static void validateQueryConfig(SqlogConfigs.QueryConfig queryConfig) {
    checkArgument(
        queryConfig.executorThreads() > 0, "QueryConfig executorThreads must be positive");
    checkArgument(queryConfig.timeoutMs() >= 0, "QueryConfig timeoutMs cannot be negative");
  }

  private static void validateStreamConfig(SqlogConfigs.StreamConfig streamConfig) {
    checkArgument(
        streamConfig.defaultLimit() >= 1 && streamConfig.defaultLimit() <= MAX_STREAM_LIMIT,
        "StreamConfig defaultLimit must be between 1 and %s",
        MAX_STREAM_LIMIT);
  }

  private static void validateTimeConfig(SqlogConfigs.TimeConfig timeConfig) {
    try {
      ZoneId.of(timeConfig.zoneId());
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("TimeConfig zoneId is invalid: " + timeConfig.zoneId(), e);
    }
    String mode = timeConfig.mode();
    checkArgument(
        TimeSelector.MODE_ALL.equalsIgnoreCase(mode)
            || TimeSelector.MODE_CUSTOM.equalsIgnoreCase(mode)
            || RelativeWindow.fromLabel(mode).isPresent(),
        "TimeConfig mode must be one of 1h, 6h, 24h, all or custom, got %s",
        mode);
    if (TimeSelector.MODE_CUSTOM.equalsIgnoreCase(mode)) {
      checkArgument(
          timeConfig.customStart() != null && timeConfig.customEnd() != null,
          "TimeConfig customStart and customEnd are required for the custom mode");
    }
  }
}
