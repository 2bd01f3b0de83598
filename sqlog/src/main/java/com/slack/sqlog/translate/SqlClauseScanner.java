package com.slack.sqlog.translate;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a SQL-shaped query into its clauses. Text is first normalised (comments removed,
 * whitespace collapsed outside of quoted literals), then the first {@code FROM <source>} is
 * dropped, and finally a single left to right pass records where each clause keyword starts.
 * Keywords inside quoted literals and keywords that are part of a longer identifier are ignored.
 */
public class SqlClauseScanner {

  public enum ClauseType {
    SELECT("SELECT"),
    WHERE("WHERE"),
    GROUP_BY("GROUP", "BY"),
    ORDER_BY("ORDER", "BY"),
    LIMIT("LIMIT");

    private final String[] words;

    ClauseType(String... words) {
      this.words = words;
    }
  }

  /** A clause keyword and the (trimmed) text up to the next keyword or the end of the query. */
  public record Clause(ClauseType type, String body) {}

  /**
   * The result of a scan. {@code preamble} is whatever came before the first keyword; for a
   * well-formed query it is empty.
   */
  public record ScanResult(String preamble, List<Clause> clauses) {

    /** First clause of the given type. Repeated clauses after the first are ignored. */
    public Optional<Clause> clause(ClauseType type) {
      return clauses.stream().filter(c -> c.type() == type).findFirst();
    }

    public boolean has(ClauseType type) {
      return clause(type).isPresent();
    }

    public Optional<String> body(ClauseType type) {
      return clause(type).map(Clause::body);
    }
  }

  private static final String FROM = "FROM";

  private SqlClauseScanner() {}

  public static ScanResult scan(String sql) {
    return scanClauses(stripFrom(normalize(sql)));
  }

  /** Removes line and block comments, collapses whitespace and trims. Quoted text is untouched. */
  static String normalize(String sql) {
    if (sql == null) {
      return "";
    }
    StringBuilder out = new StringBuilder(sql.length());
    int n = sql.length();
    char quote = 0;
    boolean pendingSpace = false;
    int i = 0;
    while (i < n) {
      char c = sql.charAt(i);
      if (quote != 0) {
        out.append(c);
        if (c == quote) {
          quote = 0;
        }
        i++;
        continue;
      }

      if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int newline = sql.indexOf('\n', i);
        i = newline < 0 ? n : newline;
        pendingSpace = true;
        continue;
      }
      if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int close = sql.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
        pendingSpace = true;
        continue;
      }
      if (Character.isWhitespace(c)) {
        pendingSpace = true;
        i++;
        continue;
      }

      if (pendingSpace && out.length() > 0) {
        out.append(' ');
      }
      pendingSpace = false;
      if (isQuote(c)) {
        quote = c;
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  /**
   * Drops the first {@code FROM <token>} where the token is a backtick, single or double quoted
   * string or a run of non-whitespace. The source is passed to the backend separately.
   */
  static String stripFrom(String text) {
    int n = text.length();
    char quote = 0;
    for (int i = 0; i < n; i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (isQuote(c)) {
        quote = c;
        continue;
      }

      int keywordEnd = matchWords(text, i, FROM);
      if (keywordEnd < 0) {
        continue;
      }
      int tokenStart = skipWhitespace(text, keywordEnd);
      int tokenEnd = tokenStart;
      if (tokenStart < n && isQuote(text.charAt(tokenStart))) {
        int close = text.indexOf(text.charAt(tokenStart), tokenStart + 1);
        tokenEnd = close < 0 ? n : close + 1;
      } else {
        while (tokenEnd < n && !Character.isWhitespace(text.charAt(tokenEnd))) {
          tokenEnd++;
        }
      }
      String before = text.substring(0, i).trim();
      String after = text.substring(tokenEnd).trim();
      if (before.isEmpty()) {
        return after;
      }
      return after.isEmpty() ? before : before + " " + after;
    }
    return text;
  }

  static ScanResult scanClauses(String text) {
    int n = text.length();
    List<ClauseType> types = new ArrayList<>();
    List<int[]> bounds = new ArrayList<>();

    char quote = 0;
    for (int i = 0; i < n; i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (isQuote(c)) {
        quote = c;
        continue;
      }
      for (ClauseType type : ClauseType.values()) {
        int end = matchWords(text, i, type.words);
        if (end >= 0) {
          types.add(type);
          bounds.add(new int[] {i, end});
          i = end - 1;
          break;
        }
      }
    }

    if (types.isEmpty()) {
      return new ScanResult(text.trim(), List.of());
    }

    ImmutableList.Builder<Clause> clauses = ImmutableList.builder();
    for (int k = 0; k < types.size(); k++) {
      int bodyStart = bounds.get(k)[1];
      int bodyEnd = k + 1 < types.size() ? bounds.get(k + 1)[0] : n;
      clauses.add(new Clause(types.get(k), text.substring(bodyStart, bodyEnd).trim()));
    }
    return new ScanResult(text.substring(0, bounds.get(0)[0]).trim(), clauses.build());
  }

  /**
   * Case-insensitive whole word match of a (possibly multi word) keyword at {@code start}.
   * Returns the index just past the keyword, or -1.
   */
  private static int matchWords(String text, int start, String... words) {
    if (start > 0 && isWordChar(text.charAt(start - 1))) {
      return -1;
    }
    int pos = start;
    for (int w = 0; w < words.length; w++) {
      if (w > 0) {
        int next = skipWhitespace(text, pos);
        if (next == pos) {
          return -1;
        }
        pos = next;
      }
      String word = words[w];
      if (!text.regionMatches(true, pos, word, 0, word.length())) {
        return -1;
      }
      pos += word.length();
    }
    if (pos < text.length() && isWordChar(text.charAt(pos))) {
      return -1;
    }
    return pos;
  }

  private static int skipWhitespace(String text, int pos) {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  static boolean isQuote(char c) {
    return c == '\'' || c == '"' || c == '`';
  }

  // '@' and '.' belong to identifiers such as @logStream or a.limit
  static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '@' || c == '.' || c == '$';
  }
}
