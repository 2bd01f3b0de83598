package com.slack.sqlog.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.slack.sqlog.config.SqlogConfigs;
import com.slack.sqlog.query.PollSleeper;
import com.slack.sqlog.query.QueryException;
import com.slack.sqlog.query.QueryExecutor;
import com.slack.sqlog.query.QueryHandle;
import com.slack.sqlog.query.ResultRow;
import com.slack.sqlog.stream.FetchException;
import com.slack.sqlog.stream.LogEvent;
import com.slack.sqlog.stream.StreamFetcher;
import com.slack.sqlog.time.TimeSelector;
import com.slack.sqlog.time.TimeWindowResolver;
import com.slack.sqlog.translate.SqlToPipelineTranslator;
import com.slack.sqlog.transport.CloudWatchLogsClientFactory;
import com.slack.sqlog.transport.CloudWatchLogsTransport;
import com.slack.sqlog.transport.InMemoryLogsTransport;
import com.slack.sqlog.transport.LogsTransport;
import com.slack.sqlog.util.JsonUtil;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entrypoint. Runs a single stream fetch or query against the configured backend and
 * prints each event or row as a line of JSON.
 *
 * <pre>
 *   sqlog &lt;config.yaml&gt; stream &lt;source&gt; [filter pattern]
 *   sqlog &lt;config.yaml&gt; query &lt;source&gt; [sql]
 * </pre>
 */
public class Sqlog {
  private static final Logger LOG = LoggerFactory.getLogger(Sqlog.class);

  static final String MODE_STREAM = "stream";
  static final String MODE_QUERY = "query";
  static final String USAGE =
      "Usage: sqlog <config.yaml> stream <source> [pattern]"
          + " | sqlog <config.yaml> query <source> [sql]";

  private final SqlogConfigs.SqlogConfig config;
  private final Clock clock;
  private final ExecutorService executorService;
  private final StreamFetcher streamFetcher;
  private final QueryExecutor queryExecutor;

  @VisibleForTesting
  Sqlog(
      SqlogConfigs.SqlogConfig config,
      LogsTransport transport,
      MeterRegistry meterRegistry,
      Clock clock,
      PollSleeper sleeper) {
    this.config = config;
    this.clock = clock;
    this.executorService =
        Executors.newFixedThreadPool(
            config.queryConfig().executorThreads(),
            new ThreadFactoryBuilder().setNameFormat("sqlog-query-%d").setDaemon(true).build());

    TimeWindowResolver resolver = new TimeWindowResolver(ZoneId.of(config.timeConfig().zoneId()));
    this.streamFetcher = new StreamFetcher(transport, resolver, meterRegistry);
    this.queryExecutor =
        new QueryExecutor(
            transport,
            resolver,
            new SqlToPipelineTranslator(),
            executorService,
            sleeper,
            meterRegistry);
    LOG.info("Started sqlog with config: {}", config);
  }

  Sqlog(SqlogConfigs.SqlogConfig config, MeterRegistry meterRegistry, Clock clock) {
    this(config, initTransport(config, clock), meterRegistry, clock, PollSleeper.SYSTEM);
  }

  public static void main(String[] args) throws Exception {
    if (args.length < 3) {
      LOG.error(USAGE);
      throw new IllegalArgumentException(USAGE);
    }
    SqlogConfig.initFromFile(Path.of(args[0]));
    SqlogConfigs.SqlogConfig config = SqlogConfig.get();
    Sqlog sqlog = new Sqlog(config, initPrometheusMeterRegistry(config), Clock.systemUTC());

    String text =
        args.length > 3 ? String.join(" ", Arrays.copyOfRange(args, 3, args.length)) : null;
    int exitCode;
    try {
      exitCode = sqlog.run(args[1], args[2], text, System.out);
    } finally {
      sqlog.shutdown();
      LogManager.shutdown();
    }
    System.exit(exitCode);
  }

  static PrometheusMeterRegistry initPrometheusMeterRegistry(SqlogConfigs.SqlogConfig config) {
    PrometheusMeterRegistry prometheusMeterRegistry =
        new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    prometheusMeterRegistry
        .config()
        .commonTags(
            "sqlog_env",
            config.metricsConfig().env(),
            "sqlog_transport",
            Strings.toRootLowerCase(config.transport().name()));
    return prometheusMeterRegistry;
  }

  static LogsTransport initTransport(SqlogConfigs.SqlogConfig config, Clock clock) {
    if (config.transport() == SqlogConfigs.TransportType.IN_MEMORY) {
      return InMemoryLogsTransport.withMockEvents(
          clock, config.mockConfig().sources(), config.mockConfig().eventsPerSource());
    }
    return new CloudWatchLogsTransport(
        CloudWatchLogsClientFactory.initClient(config.awsConfig()), clock);
  }

  /**
   * Runs one request and writes the results to {@code out}.
   *
   * @param text the filter pattern in stream mode or the SQL in query mode, may be null
   * @return a process exit code
   */
  int run(String mode, String source, String text, PrintStream out)
      throws InterruptedException, JsonProcessingException {
    TimeSelector selector =
        TimeSelector.fromMode(
            config.timeConfig().mode(),
            config.timeConfig().customStart(),
            config.timeConfig().customEnd());

    if (MODE_STREAM.equalsIgnoreCase(mode)) {
      try {
        List<LogEvent> events =
            streamFetcher.fetchStream(
                source, text, selector, config.streamConfig().defaultLimit(), clock.millis());
        for (LogEvent event : events) {
          out.println(JsonUtil.writeAsString(event));
        }
        return 0;
      } catch (FetchException e) {
        LOG.error("Stream fetch failed ({}): {}", e.getReason(), e.getMessage());
        return 1;
      }
    } else if (MODE_QUERY.equalsIgnoreCase(mode)) {
      String sql =
          StringUtils.isBlank(text) ? SqlToPipelineTranslator.defaultSqlFor(source) : text;
      QueryHandle handle = queryExecutor.submit(source, sql, selector, clock.millis());
      try {
        long timeoutMs = config.queryConfig().timeoutMs();
        List<ResultRow> rows =
            timeoutMs > 0 ? handle.get(Duration.ofMillis(timeoutMs)) : handle.get();
        for (ResultRow row : rows) {
          out.println(JsonUtil.writeAsString(row.columns()));
        }
        return 0;
      } catch (QueryException e) {
        LOG.error("Query failed ({}): {}", e.getReason(), e.getMessage());
        return 1;
      }
    }
    LOG.error("Unknown mode '{}'. {}", mode, USAGE);
    return 2;
  }

  void shutdown() {
    LOG.info("Shutting down sqlog");
    MoreExecutors.shutdownAndAwaitTermination(executorService, 5, TimeUnit.SECONDS);
  }
}
