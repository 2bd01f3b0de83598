package com.slack.sqlog.translate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An ordered list of {@link Stage}s. Stages are kept in rank order no matter how they were
 * supplied, and {@link #render()} joins them with the pipe separator. The rendered text is what
 * gets submitted to the analytics backend.
 */
public class PipelineQuery {
  public static final String STAGE_SEPARATOR = " | ";

  private final List<Stage> stages;
  private final List<String> warnings;
  private final boolean fallback;

  PipelineQuery(List<Stage> stages, List<String> warnings, boolean fallback) {
    Preconditions.checkArgument(!stages.isEmpty(), "a pipeline needs at least one stage");
    this.stages =
        stages.stream()
            .sorted(Comparator.comparingInt(Stage::rank))
            .collect(ImmutableList.toImmutableList());
    this.warnings = ImmutableList.copyOf(warnings);
    this.fallback = fallback;
  }

  public static PipelineQuery of(List<Stage> stages) {
    return new PipelineQuery(stages, List.of(), false);
  }

  public List<Stage> getStages() {
    return stages;
  }

  /** Problems noticed while translating, e.g. a LIKE pattern that is not a valid regex. */
  public List<String> getWarnings() {
    return warnings;
  }

  /** True when the input was not recognised and the default pipeline was produced instead. */
  public boolean isFallback() {
    return fallback;
  }

  public <T extends Stage> Optional<T> getStage(Class<T> stageClass) {
    return stages.stream().filter(stageClass::isInstance).map(stageClass::cast).findFirst();
  }

  public String render() {
    return stages.stream().map(Stage::render).collect(Collectors.joining(STAGE_SEPARATOR));
  }

  @Override
  public String toString() {
    return render();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PipelineQuery)) return false;
    PipelineQuery that = (PipelineQuery) o;
    return stages.equals(that.stages);
  }

  @Override
  public int hashCode() {
    return stages.hashCode();
  }
}
