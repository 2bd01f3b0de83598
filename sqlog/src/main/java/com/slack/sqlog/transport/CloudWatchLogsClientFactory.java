package com.slack.sqlog.transport;

import com.google.common.base.Preconditions;
import com.slack.sqlog.config.SqlogConfigs;
import java.net.URI;
import java.net.URISyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClientBuilder;

public class CloudWatchLogsClientFactory {
  private static final Logger LOG = LoggerFactory.getLogger(CloudWatchLogsClientFactory.class);

  private CloudWatchLogsClientFactory() {}

  public static CloudWatchLogsClient initClient(SqlogConfigs.AwsConfig config) {
    Preconditions.checkArgument(notNullOrEmpty(config.region()), "awsConfig.region is required");

    CloudWatchLogsClientBuilder builder =
        CloudWatchLogsClient.builder()
            .region(Region.of(config.region()))
            .credentialsProvider(credentialsProvider(config));

    if (notNullOrEmpty(config.endpoint())) {
      try {
        builder.endpointOverride(new URI(config.endpoint()));
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException("Invalid endpoint " + config.endpoint(), e);
      }
    }
    LOG.info("Created CloudWatch Logs client for region {}", config.region());
    return builder.build();
  }

  static AwsCredentialsProvider credentialsProvider(SqlogConfigs.AwsConfig config) {
    if (notNullOrEmpty(config.accessKey()) && notNullOrEmpty(config.secretKey())) {
      if (notNullOrEmpty(config.sessionToken())) {
        return StaticCredentialsProvider.create(
            AwsSessionCredentials.create(
                config.accessKey(), config.secretKey(), config.sessionToken()));
      }
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(config.accessKey(), config.secretKey()));
    }
    return DefaultCredentialsProvider.create();
  }

  static boolean notNullOrEmpty(String target) {
    return target != null && !target.isEmpty();
  }
}
