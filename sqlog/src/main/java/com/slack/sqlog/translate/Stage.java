package com.slack.sqlog.translate;

import com.google.common.base.Preconditions;

/**
 * A single stage of a piped-stage query. Stages render to the backend's syntax and carry a rank
 * that fixes their position in the pipeline: filter, then one projection (fields or stats), then
 * sort, then limit.
 */
public interface Stage {

  int rank();

  String render();

  record Filter(String expression) implements Stage {
    public Filter {
      Preconditions.checkArgument(expression != null && !expression.isBlank());
    }

    @Override
    public int rank() {
      return 0;
    }

    @Override
    public String render() {
      return "filter " + expression;
    }
  }

  record Fields(String columns) implements Stage {
    public Fields {
      Preconditions.checkArgument(columns != null && !columns.isBlank());
    }

    @Override
    public int rank() {
      return 1;
    }

    @Override
    public String render() {
      return "fields " + columns;
    }
  }

  /** An aggregation, optionally grouped. {@code groupBy} is null when there's no grouping. */
  record Stats(String aggregation, String groupBy) implements Stage {
    public Stats {
      Preconditions.checkArgument(aggregation != null && !aggregation.isBlank());
    }

    @Override
    public int rank() {
      return 1;
    }

    @Override
    public String render() {
      if (groupBy == null || groupBy.isBlank()) {
        return "stats " + aggregation;
      }
      return "stats " + aggregation + " by " + groupBy;
    }
  }

  record Sort(String expression) implements Stage {
    public Sort {
      Preconditions.checkArgument(expression != null && !expression.isBlank());
    }

    @Override
    public int rank() {
      return 2;
    }

    @Override
    public String render() {
      return "sort " + expression;
    }
  }

  /** The value isn't validated as a number; the backend rejects a malformed limit. */
  record Limit(String value) implements Stage {
    public Limit {
      Preconditions.checkArgument(value != null && !value.isBlank());
    }

    @Override
    public int rank() {
      return 3;
    }

    @Override
    public String render() {
      return "limit " + value;
    }
  }
}
