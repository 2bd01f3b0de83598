package com.slack.sqlog.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One result row keyed by column name, in the order the backend reported the columns. */
public record ResultRow(Map<String, String> columns) {
  public ResultRow {
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
  }

  public String get(String column) {
    return columns.get(column);
  }
}
