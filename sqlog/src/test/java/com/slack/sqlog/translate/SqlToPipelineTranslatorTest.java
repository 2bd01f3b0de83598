package com.slack.sqlog.translate;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

public class SqlToPipelineTranslatorTest {
  private static final String DEFAULT_PIPELINE =
      "fields @timestamp, @message, @logStream, @log | sort @timestamp desc | limit 20";

  private final SqlToPipelineTranslator translator = new SqlToPipelineTranslator();

  private String translate(String sql) {
    return translator.translate(sql).render();
  }

  @Test
  public void testFilterIsMovedAheadOfProjection() {
    assertThat(
            translate(
                "SELECT @message FROM x WHERE @message LIKE '%error%' ORDER BY @timestamp LIMIT 5"))
        .isEqualTo("filter @message like /error/ | fields @message | sort @timestamp | limit 5");
  }

  @Test
  public void testClauseOrderInInputDoesNotMatter() {
    assertThat(translate("LIMIT 5 ORDER BY @timestamp WHERE @logStream = 'a' SELECT @message"))
        .isEqualTo("filter @logStream = 'a' | fields @message | sort @timestamp | limit 5");
  }

  @Test
  public void testSelectStarExpandsToDefaultColumns() {
    PipelineQuery query = translator.translate("SELECT * FROM x");
    assertThat(query.render()).isEqualTo("fields @timestamp, @message, @logStream, @log");
    assertThat(query.getStage(Stage.Fields.class))
        .contains(new Stage.Fields("@timestamp, @message, @logStream, @log"));
  }

  @Test
  public void testGroupedAggregation() {
    PipelineQuery query = translator.translate("SELECT count(*) FROM x GROUP BY @logStream");
    assertThat(query.getStage(Stage.Stats.class))
        .contains(new Stage.Stats("count(*)", "@logStream"));
    assertThat(query.render()).isEqualTo("stats count(*) by @logStream");
  }

  @Test
  public void testAggregationWithoutGroupBy() {
    assertThat(translate("SELECT avg(duration), max(duration) FROM x WHERE level = 'ERROR'"))
        .isEqualTo("filter level = 'ERROR' | stats avg(duration), max(duration)");
  }

  @Test
  public void testAggregationFunctionsAreCaseInsensitive() {
    assertThat(translate("SELECT COUNT(*), PCT(latency, 99), bin(5m) FROM x"))
        .isEqualTo("stats COUNT(*), PCT(latency, 99), bin(5m)");
  }

  @Test
  public void testFunctionNamesInsideIdentifiersAreNotAggregations() {
    assertThat(translate("SELECT discount(price) FROM x"))
        .isEqualTo("fields discount(price)");
    assertThat(translate("SELECT count (x) FROM x")).isEqualTo("fields count (x)");
  }

  @Test
  public void testGroupByAloneMakesStats() {
    assertThat(translate("SELECT @logStream FROM x GROUP BY @logStream"))
        .isEqualTo("stats @logStream by @logStream");
  }

  @Test
  public void testWildcardWithAggregationEmitsNoProjection() {
    PipelineQuery query =
        translator.translate("SELECT * FROM x GROUP BY @logStream ORDER BY @timestamp");
    assertThat(query.getStage(Stage.Fields.class)).isEmpty();
    assertThat(query.getStage(Stage.Stats.class)).isEmpty();
    assertThat(query.render()).isEqualTo("sort @timestamp");
  }

  @Test
  public void testEmptyInputFallsBack() {
    PipelineQuery query = translator.translate("");
    assertThat(query.render()).isEqualTo(DEFAULT_PIPELINE);
    assertThat(query.isFallback()).isTrue();
    assertThat(translate(null)).isEqualTo(DEFAULT_PIPELINE);
    assertThat(translate("   \n\t ")).isEqualTo(DEFAULT_PIPELINE);
  }

  @Test
  public void testInputWithoutKeywordsFallsBack() {
    assertThat(translate("show me the errors")).isEqualTo(DEFAULT_PIPELINE);
    assertThat(translate("FROM my-group")).isEqualTo(DEFAULT_PIPELINE);
  }

  @Test
  public void testTranslatingPipelineTextFallsBack() {
    String once = translate("garbage");
    assertThat(once).isEqualTo(DEFAULT_PIPELINE);
    assertThat(translate(once)).isEqualTo(DEFAULT_PIPELINE);
    assertThat(translate("filter @message like /x/ | limit 5")).isEqualTo(DEFAULT_PIPELINE);
  }

  @Test
  public void testKeywordsAreMatchedAsWholeWords() {
    assertThat(translate("SELECT selected, limited FROM x WHERE wherever = 1"))
        .isEqualTo("filter wherever = 1 | fields selected, limited");
    assertThat(translate("SELECT @limit FROM x")).isEqualTo("fields @limit");
  }

  @Test
  public void testKeywordsInsideQuotesAreIgnored() {
    assertThat(translate("SELECT @message FROM x WHERE @message LIKE '%order by limit%'"))
        .isEqualTo("filter @message like /order by limit/ | fields @message");
  }

  @Test
  public void testLowercaseKeywordsAndExtraWhitespace() {
    assertThat(translate("select   @message\n\nfrom   x\norder    by @timestamp desc\nlimit 10"))
        .isEqualTo("fields @message | sort @timestamp desc | limit 10");
  }

  @Test
  public void testCommentsAreStripped() {
    String sql =
        "-- recent errors\n"
            + "SELECT @message /* the raw line */ FROM x\n"
            + "WHERE @message LIKE '%ERROR%' -- only errors\n"
            + "LIMIT 10";
    assertThat(translate(sql))
        .isEqualTo("filter @message like /ERROR/ | fields @message | limit 10");
  }

  @Test
  public void testCommentMarkersInsideQuotesAreKept() {
    assertThat(translate("SELECT @message FROM x WHERE @message = 'a -- b'"))
        .isEqualTo("filter @message = 'a -- b' | fields @message");
  }

  @Test
  public void testQuotedSourceNames() {
    assertThat(translate("SELECT @message FROM `/aws/lambda/my function` LIMIT 1"))
        .isEqualTo("fields @message | limit 1");
    assertThat(translate("SELECT @message FROM '/aws/rds/db' LIMIT 1"))
        .isEqualTo("fields @message | limit 1");
    assertThat(translate("SELECT @message FROM \"/aws/vpc/flow-logs\" LIMIT 1"))
        .isEqualTo("fields @message | limit 1");
    assertThat(translate("SELECT @message FROM /aws/lambda/fn LIMIT 1"))
        .isEqualTo("fields @message | limit 1");
  }

  @Test
  public void testDefaultSqlTemplate() {
    String sql = SqlToPipelineTranslator.defaultSqlFor("/aws/lambda/my-function-prod");
    assertThat(sql)
        .isEqualTo(
            "SELECT @timestamp, @message\n"
                + "FROM `/aws/lambda/my-function-prod`\n"
                + "ORDER BY @timestamp DESC\n"
                + "LIMIT 20");
    assertThat(translate(sql))
        .isEqualTo("fields @timestamp, @message | sort @timestamp DESC | limit 20");
  }

  @Test
  public void testLikeVariants() {
    assertThat(translate("SELECT a FROM x WHERE @message LIKE 'timeout'"))
        .isEqualTo("filter @message like /timeout/ | fields a");
    assertThat(translate("SELECT a FROM x WHERE @message like \"%timeout%\""))
        .isEqualTo("filter @message like /timeout/ | fields a");
    assertThat(translate("SELECT a FROM x WHERE @message LIKE '%time%out'"))
        .isEqualTo("filter @message like /time%out/ | fields a");
    assertThat(translate("SELECT a FROM x WHERE @message LIKE 'start%'"))
        .isEqualTo("filter @message like /start/ | fields a");
  }

  @Test
  public void testLogicalConnectivesAreLowercased() {
    assertThat(
            translate(
                "SELECT a FROM x WHERE @message LIKE '%a%' AND NOT @message LIKE '%b%' OR level"
                    + " = 'AND'"))
        .isEqualTo(
            "filter @message like /a/ and not @message like /b/ or level = 'AND' | fields a");
  }

  @Test
  public void testOtherTokensPassThrough() {
    assertThat(translate("SELECT a FROM x WHERE status >= 500 AND Band = 'x'"))
        .isEqualTo("filter status >= 500 and Band = 'x' | fields a");
  }

  @Test
  public void testLikeWithoutQuotedPatternIsLeftAlone() {
    assertThat(translate("SELECT a FROM x WHERE @message LIKE ''"))
        .isEqualTo("filter @message LIKE '' | fields a");
    assertThat(translate("SELECT a FROM x WHERE @message LIKE other"))
        .isEqualTo("filter @message LIKE other | fields a");
  }

  @Test
  public void testSuspiciousLikePatternsAreFlagged() {
    PipelineQuery slash = translator.translate("SELECT a FROM x WHERE path LIKE '%/api/%'");
    assertThat(slash.render()).isEqualTo("filter path like //api// | fields a");
    assertThat(slash.getWarnings()).hasSize(1);
    assertThat(slash.getWarnings().get(0)).contains("unescaped '/'");

    PipelineQuery invalid = translator.translate("SELECT a FROM x WHERE @message LIKE '%[%'");
    assertThat(invalid.render()).isEqualTo("filter @message like /[/ | fields a");
    assertThat(invalid.getWarnings()).hasSize(1);
    assertThat(invalid.getWarnings().get(0)).contains("not a valid regular expression");

    assertThat(translator.translate("SELECT a FROM x WHERE b LIKE '%ok%'").getWarnings())
        .isEmpty();
  }

  @Test
  public void testLimitTakesFirstInteger() {
    assertThat(translate("SELECT a FROM x LIMIT 50 OFFSET 10")).isEqualTo("fields a | limit 50");
    assertThat(translate("SELECT a FROM x LIMIT 25;")).isEqualTo("fields a | limit 25");
  }

  @Test
  public void testNonNumericLimitIsPassedThrough() {
    assertThat(translate("SELECT a FROM x LIMIT all")).isEqualTo("fields a | limit all");
  }

  @Test
  public void testEmptyClausesAreSkipped() {
    assertThat(translate("SELECT a FROM x WHERE LIMIT 5")).isEqualTo("fields a | limit 5");
    assertThat(translate("SELECT")).isEqualTo(DEFAULT_PIPELINE);
  }

  @Test
  public void testRepeatedClauseKeepsFirstOccurrence() {
    assertThat(translate("SELECT a FROM x LIMIT 5 LIMIT 10")).isEqualTo("fields a | limit 5");
  }

  @Test
  public void testWhereOnly() {
    assertThat(translate("WHERE @message LIKE '%panic%'"))
        .isEqualTo("filter @message like /panic/");
  }
}
