package com.slack.sqlog.translate;

import com.slack.sqlog.translate.SqlClauseScanner.ClauseType;
import com.slack.sqlog.translate.SqlClauseScanner.ScanResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates the restricted SQL dialect operators type into the piped-stage dialect the analytics
 * backend understands.
 *
 * <p>Translation never fails. Query text is edited interactively, so input that can't be
 * recognised (empty text, no clause keywords, or text that doesn't start with one) produces the
 * default pipeline {@code fields @timestamp, @message, @logStream, @log | sort @timestamp desc |
 * limit 20}.
 *
 * <p>Clauses may appear in any order; the output is always filter, projection, sort, limit.
 */
public class SqlToPipelineTranslator {
  private static final Logger LOG = LoggerFactory.getLogger(SqlToPipelineTranslator.class);

  public static final String DEFAULT_COLUMNS = "@timestamp, @message, @logStream, @log";
  public static final String DEFAULT_SORT = "@timestamp desc";
  public static final String DEFAULT_LIMIT = "20";

  private static final PipelineQuery DEFAULT_PIPELINE =
      new PipelineQuery(
          List.of(
              new Stage.Fields(DEFAULT_COLUMNS),
              new Stage.Sort(DEFAULT_SORT),
              new Stage.Limit(DEFAULT_LIMIT)),
          List.of(),
          true);

  private static final Pattern AGGREGATION_CALL =
      Pattern.compile("\\b(count|avg|sum|min|max|stddev|pct|bin)\\(", Pattern.CASE_INSENSITIVE);
  private static final Pattern INTEGER = Pattern.compile("\\d+");
  private static final String WILDCARD = "*";

  public static PipelineQuery defaultPipeline() {
    return DEFAULT_PIPELINE;
  }

  /** The query offered to an operator when they pick a source. */
  public static String defaultSqlFor(String source) {
    return "SELECT @timestamp, @message\nFROM `"
        + source
        + "`\nORDER BY @timestamp DESC\nLIMIT 20";
  }

  public PipelineQuery translate(String sql) {
    ScanResult scan = SqlClauseScanner.scan(sql);
    if (!scan.preamble().isEmpty()) {
      LOG.debug("Query does not start with a clause keyword, using default pipeline: {}", sql);
      return DEFAULT_PIPELINE;
    }

    List<Stage> stages = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    scan.body(ClauseType.WHERE)
        .filter(body -> !body.isEmpty())
        .ifPresent(body -> stages.add(new Stage.Filter(rewriteCondition(body, warnings))));
    projection(scan).ifPresent(stages::add);
    scan.body(ClauseType.ORDER_BY)
        .filter(body -> !body.isEmpty())
        .ifPresent(body -> stages.add(new Stage.Sort(body)));
    scan.body(ClauseType.LIMIT)
        .filter(body -> !body.isEmpty())
        .ifPresent(body -> stages.add(new Stage.Limit(limitValue(body))));

    if (stages.isEmpty()) {
      LOG.debug("No stages recognised, using default pipeline: {}", sql);
      return DEFAULT_PIPELINE;
    }
    return new PipelineQuery(stages, warnings, false);
  }

  /**
   * SELECT becomes {@code stats} when it calls an aggregate function or the query is grouped, and
   * {@code fields} otherwise. A bare {@code *} expands to the default columns, except when the
   * query is also aggregated or grouped: that combination has no clear meaning and produces no
   * projection at all.
   */
  private static Optional<Stage> projection(ScanResult scan) {
    Optional<String> select = scan.body(ClauseType.SELECT).filter(body -> !body.isEmpty());
    if (select.isEmpty()) {
      return Optional.empty();
    }
    String body = select.get();
    boolean aggregated = AGGREGATION_CALL.matcher(body).find() || scan.has(ClauseType.GROUP_BY);

    if (WILDCARD.equals(body)) {
      if (aggregated) {
        LOG.debug("SELECT * with aggregation or grouping, emitting no projection");
        return Optional.empty();
      }
      return Optional.of(new Stage.Fields(DEFAULT_COLUMNS));
    }
    if (aggregated) {
      String groupBy = scan.body(ClauseType.GROUP_BY).filter(g -> !g.isEmpty()).orElse(null);
      return Optional.of(new Stage.Stats(body, groupBy));
    }
    return Optional.of(new Stage.Fields(body));
  }

  private static String limitValue(String body) {
    Matcher matcher = INTEGER.matcher(body);
    return matcher.find() ? matcher.group() : body;
  }

  /**
   * Rewrites {@code LIKE 'pattern'} (single or double quoted) to {@code like /pattern/} with one
   * leading and one trailing {@code %} removed, and lowercases AND, OR and NOT. Everything else,
   * including the contents of quoted literals, is copied as is.
   */
  static String rewriteCondition(String body, List<String> warnings) {
    StringBuilder out = new StringBuilder(body.length());
    int n = body.length();
    int i = 0;
    while (i < n) {
      char c = body.charAt(i);
      if (SqlClauseScanner.isQuote(c)) {
        int close = body.indexOf(c, i + 1);
        int end = close < 0 ? n : close + 1;
        out.append(body, i, end);
        i = end;
        continue;
      }
      if (!SqlClauseScanner.isWordChar(c)) {
        out.append(c);
        i++;
        continue;
      }

      int wordEnd = i;
      while (wordEnd < n && SqlClauseScanner.isWordChar(body.charAt(wordEnd))) {
        wordEnd++;
      }
      String word = body.substring(i, wordEnd);
      if (word.equalsIgnoreCase("LIKE")) {
        int patternStart = wordEnd;
        while (patternStart < n && Character.isWhitespace(body.charAt(patternStart))) {
          patternStart++;
        }
        if (patternStart > wordEnd && patternStart < n) {
          char quote = body.charAt(patternStart);
          int close = (quote == '\'' || quote == '"') ? body.indexOf(quote, patternStart + 1) : -1;
          if (close > patternStart + 1) {
            out.append(likeToRegex(body.substring(patternStart + 1, close), warnings));
            i = close + 1;
            continue;
          }
        }
        out.append(word);
      } else if (word.equalsIgnoreCase("AND")
          || word.equalsIgnoreCase("OR")
          || word.equalsIgnoreCase("NOT")) {
        out.append(word.toLowerCase(Locale.ROOT));
      } else {
        out.append(word);
      }
      i = wordEnd;
    }
    return out.toString();
  }

  // The pattern is not escaped: '/' or regex metacharacters reach the backend unchanged.
  private static String likeToRegex(String pattern, List<String> warnings) {
    String regex = pattern;
    if (regex.startsWith("%")) {
      regex = regex.substring(1);
    }
    if (regex.endsWith("%")) {
      regex = regex.substring(0, regex.length() - 1);
    }

    if (regex.indexOf('/') >= 0) {
      warn(warnings, String.format("LIKE pattern '%s' contains an unescaped '/'", pattern));
    }
    try {
      Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      warn(
          warnings,
          String.format(
              "LIKE pattern '%s' is not a valid regular expression: %s",
              pattern, e.getDescription()));
    }
    return "like /" + regex + "/";
  }

  private static void warn(List<String> warnings, String warning) {
    LOG.warn("{}", warning);
    warnings.add(warning);
  }
}
