package com.slack.sqlog.time;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

public class TimeWindowResolverTest {
  private static final long NOW = 1_704_103_200_000L; // 2024-01-01T10:00:00Z

  private final TimeWindowResolver resolver = new TimeWindowResolver(ZoneOffset.UTC);

  @Test
  public void testRelativeWindows() throws TimeWindowException {
    TimeRange oneHour = resolver.resolve(new TimeSelector.Relative(RelativeWindow.ONE_HOUR), NOW);
    assertThat(oneHour.endEpochMs()).isEqualTo(NOW);
    assertThat(oneHour.durationMs()).isEqualTo(3_600_000L);

    TimeRange sixHours =
        resolver.resolve(new TimeSelector.Relative(RelativeWindow.SIX_HOURS), NOW);
    assertThat(sixHours.startEpochMs()).isEqualTo(NOW - 21_600_000L);
    assertThat(sixHours.endEpochMs()).isEqualTo(NOW);

    TimeRange day =
        resolver.resolve(new TimeSelector.Relative(RelativeWindow.TWENTY_FOUR_HOURS), NOW);
    assertThat(day.startEpochMs()).isEqualTo(NOW - 86_400_000L);
  }

  @Test
  public void testResolveIsDeterministic() throws TimeWindowException {
    TimeSelector selector = TimeSelector.lastHour();
    TimeRange first = resolver.resolve(selector, NOW);
    TimeRange second = resolver.resolve(selector, NOW);
    assertThat(first).isEqualTo(second);
  }

  @Test
  public void testAllTimeStartsAtEpoch() throws TimeWindowException {
    TimeRange range = resolver.resolve(new TimeSelector.AllTime(), NOW);
    assertThat(range.startEpochMs()).isZero();
    assertThat(range.endEpochMs()).isEqualTo(NOW);
  }

  @Test
  public void testCustomRangeUsesConfiguredZone() throws TimeWindowException {
    TimeRange utc =
        resolver.resolve(new TimeSelector.Custom("2024-01-01T10:00", "2024-01-01T11:30"), NOW);
    assertThat(utc.startEpochMs()).isEqualTo(NOW);
    assertThat(utc.endEpochMs()).isEqualTo(NOW + 5_400_000L);

    TimeWindowResolver berlin = new TimeWindowResolver(ZoneId.of("Europe/Berlin"));
    TimeRange local =
        berlin.resolve(new TimeSelector.Custom("2024-01-01T11:00", "2024-01-01T12:00"), NOW);
    assertThat(local.startEpochMs()).isEqualTo(NOW);
    assertThat(local.endEpochMs())
        .isEqualTo(
            LocalDateTime.of(2024, 1, 1, 11, 0).toInstant(ZoneOffset.UTC).toEpochMilli());
  }

  @Test
  public void testCustomRangeAcceptsSeconds() throws TimeWindowException {
    TimeRange range =
        resolver.resolve(
            new TimeSelector.Custom("2024-01-01T10:00:30", "2024-01-01T10:00:45"), NOW);
    assertThat(range.durationMs()).isEqualTo(15_000L);
  }

  @Test
  public void testEqualCustomBoundsAreAllowed() throws TimeWindowException {
    TimeRange range =
        resolver.resolve(new TimeSelector.Custom("2024-01-01T10:00", "2024-01-01T10:00"), NOW);
    assertThat(range.durationMs()).isZero();
  }

  @Test
  public void testInvertedCustomRange() {
    assertThatExceptionOfType(TimeWindowException.class)
        .isThrownBy(
            () ->
                resolver.resolve(
                    new TimeSelector.Custom("2024-01-02T10:00", "2024-01-01T10:00"), NOW))
        .satisfies(
            e -> assertThat(e.getReason()).isEqualTo(TimeWindowException.Reason.INVERTED_RANGE));
  }

  @Test
  public void testUnparseableCustomBounds() {
    assertThatExceptionOfType(TimeWindowException.class)
        .isThrownBy(
            () -> resolver.resolve(new TimeSelector.Custom("yesterday", "2024-01-01T10:00"), NOW))
        .satisfies(
            e ->
                assertThat(e.getReason())
                    .isEqualTo(TimeWindowException.Reason.INVALID_TIMESTAMP));

    assertThatExceptionOfType(TimeWindowException.class)
        .isThrownBy(
            () -> resolver.resolve(new TimeSelector.Custom("2024-01-01T10:00", "2024-13-01"), NOW))
        .satisfies(
            e ->
                assertThat(e.getReason())
                    .isEqualTo(TimeWindowException.Reason.INVALID_TIMESTAMP));

    // parses as a date but is past the largest epoch millisecond
    assertThatExceptionOfType(TimeWindowException.class)
        .isThrownBy(
            () ->
                resolver.resolve(
                    new TimeSelector.Custom("2024-01-01T00:00", "+999999999-12-31T23:59"), NOW))
        .withCauseInstanceOf(ArithmeticException.class)
        .satisfies(
            e ->
                assertThat(e.getReason())
                    .isEqualTo(TimeWindowException.Reason.INVALID_TIMESTAMP));
  }

  @Test
  public void testMissingCustomBound() {
    assertThatExceptionOfType(TimeWindowException.class)
        .isThrownBy(() -> resolver.resolve(new TimeSelector.Custom(null, "2024-01-01T10:00"), NOW))
        .satisfies(
            e ->
                assertThat(e.getReason())
                    .isEqualTo(TimeWindowException.Reason.INVALID_TIMESTAMP));
  }

  @Test
  public void testTimeRangeRejectsInvertedBounds() {
    assertThatIllegalArgumentException().isThrownBy(() -> new TimeRange(10, 9));
  }

  @Test
  public void testSecondResolutionBounds() {
    TimeRange range = new TimeRange(1_999L, 5_500L);
    assertThat(range.startEpochSeconds()).isEqualTo(1L);
    assertThat(range.endEpochSeconds()).isEqualTo(5L);
  }
}
