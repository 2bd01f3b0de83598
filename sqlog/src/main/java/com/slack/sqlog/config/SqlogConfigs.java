package com.slack.sqlog.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * The configuration tree, bound from YAML or JSON. Absent sections and fields take the defaults
 * below.
 */
public final class SqlogConfigs {

  private SqlogConfigs() {}

  public enum TransportType {
    CLOUDWATCH,
    IN_MEMORY
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SqlogConfig(
      TransportType transport,
      AwsConfig awsConfig,
      QueryConfig queryConfig,
      StreamConfig streamConfig,
      TimeConfig timeConfig,
      MetricsConfig metricsConfig,
      MockConfig mockConfig) {
    public SqlogConfig {
      transport = transport == null ? TransportType.CLOUDWATCH : transport;
      awsConfig = awsConfig == null ? new AwsConfig(null, null, null, null, null) : awsConfig;
      queryConfig = queryConfig == null ? new QueryConfig(null, null) : queryConfig;
      streamConfig = streamConfig == null ? new StreamConfig(null) : streamConfig;
      timeConfig = timeConfig == null ? new TimeConfig(null, null, null, null) : timeConfig;
      metricsConfig = metricsConfig == null ? new MetricsConfig(null) : metricsConfig;
      mockConfig = mockConfig == null ? new MockConfig(null, null) : mockConfig;
    }
  }

  /** Credentials are optional; without them the default AWS credentials chain is used. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AwsConfig(
      String region, String accessKey, String secretKey, String sessionToken, String endpoint) {

    @Override
    public String toString() {
      return "AwsConfig[region="
          + region
          + ", accessKey="
          + (accessKey == null ? null : "***")
          + ", endpoint="
          + endpoint
          + "]";
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record QueryConfig(Integer executorThreads, Long timeoutMs) {
    public static final int DEFAULT_EXECUTOR_THREADS = 4;

    public QueryConfig {
      executorThreads = executorThreads == null ? DEFAULT_EXECUTOR_THREADS : executorThreads;
      // 0 disables the timeout
      timeoutMs = timeoutMs == null ? 0L : timeoutMs;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record StreamConfig(Integer defaultLimit) {
    public static final int DEFAULT_LIMIT = 100;

    public StreamConfig {
      defaultLimit = defaultLimit == null ? DEFAULT_LIMIT : defaultLimit;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TimeConfig(String zoneId, String mode, String customStart, String customEnd) {
    public TimeConfig {
      zoneId = zoneId == null || zoneId.isBlank() ? "UTC" : zoneId;
      mode = mode == null || mode.isBlank() ? "1h" : mode;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record MetricsConfig(String env) {
    public MetricsConfig {
      env = env == null || env.isBlank() ? "local" : env;
    }
  }

  /** Seed data for the {@link TransportType#IN_MEMORY} transport. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record MockConfig(List<String> sources, Integer eventsPerSource) {
    public static final List<String> DEFAULT_SOURCES =
        List.of(
            "/aws/lambda/my-function-prod",
            "/aws/lambda/my-function-staging",
            "/aws/rds/cluster/db-cluster-1/postgresql",
            "/aws/eks/main-cluster/cluster",
            "/aws/vpc/flow-logs");

    public MockConfig {
      sources = sources == null || sources.isEmpty() ? DEFAULT_SOURCES : List.copyOf(sources);
      eventsPerSource = eventsPerSource == null ? 100 : eventsPerSource;
    }
  }
}
