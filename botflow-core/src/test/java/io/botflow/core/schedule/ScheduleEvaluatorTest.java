package io.botflow.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ScheduleEvaluator")
class ScheduleEvaluatorTest {

    private static final String LIMA = "America/Lima";

    private final ScheduleEvaluator evaluator = new ScheduleEvaluator();

    /// 2024-06-03 is a Monday; Lima is UTC-5 all year.
    private static Instant lima(int day, int hour, int minute) {
        return ZonedDateTime.of(2024, 6, day, hour, minute, 0, 0, ZoneId.of(LIMA)).toInstant();
    }

    private static CustomSchedule weekdays() {
        return CustomSchedule.defaultSchedule(LIMA);
    }

    private static TimeWindow window(DayOfWeek day, String start, String end, boolean overnight) {
        return new TimeWindow(EnumSet.of(day), start, end, overnight);
    }

    private static CustomSchedule fridayNight() {
        TimeWindow window = new TimeWindow(EnumSet.of(DayOfWeek.FRIDAY), "22:00", "06:00", true);
        return new CustomSchedule(LIMA, List.of(window), List.of());
    }

    @Nested
    @DisplayName("isInWindow")
    class IsInWindow {

        @ParameterizedTest(name = "June {0} {1}:{2} -> {3}")
        @CsvSource({
            "3, 10, 0, true",
            "3, 9, 0, true",
            "3, 8, 59, false",
            "3, 17, 59, true",
            "3, 18, 0, false",
            "8, 10, 0, false",
            "9, 12, 0, false"
        })
        void shouldMatchWeekdayWindowWithExclusiveEnd(
                int day, int hour, int minute, boolean expected) {
            assertThat(evaluator.isInWindow(lima(day, hour, minute), weekdays()))
                    .isEqualTo(expected);
        }

        @ParameterizedTest(name = "June {0} {1}:{2} -> {3}")
        @CsvSource({
            "7, 21, 59, false",
            "7, 22, 0, true",
            "7, 23, 30, true",
            "8, 5, 30, true",
            "8, 6, 0, false",
            "8, 23, 0, false",
            "6, 3, 0, false"
        })
        void shouldCarryOvernightWindowIntoNextDay(
                int day, int hour, int minute, boolean expected) {
            assertThat(evaluator.isInWindow(lima(day, hour, minute), fridayNight()))
                    .isEqualTo(expected);
        }

        @Test
        void shouldTreatReversedUnflaggedWindowAsOvernight() {
            TimeWindow window =
                    new TimeWindow(EnumSet.of(DayOfWeek.FRIDAY), "22:00", "06:00", false);
            CustomSchedule schedule = new CustomSchedule(LIMA, List.of(window), List.of());

            assertThat(evaluator.isInWindow(lima(8, 5, 0), schedule)).isTrue();
        }

        @Test
        void shouldHonorClosedAndOverrideExceptions() {
            // Given
            CustomSchedule schedule =
                    new CustomSchedule(
                            LIMA,
                            List.of(TimeWindow.defaultWindow()),
                            List.of(
                                    new DateException("2024-06-03", true, null, null),
                                    new DateException("2024-06-04", false, "12:00", "14:00"),
                                    new DateException("2024-06-05", false, "12:00", null)));

            // When / Then
            assertThat(evaluator.isInWindow(lima(3, 10, 0), schedule)).isFalse();
            assertThat(evaluator.isInWindow(lima(4, 10, 0), schedule)).isFalse();
            assertThat(evaluator.isInWindow(lima(4, 13, 0), schedule)).isTrue();
            assertThat(evaluator.isInWindow(lima(5, 10, 0), schedule)).isTrue();
        }

        @Test
        void shouldTreatUnknownOrMissingTimezoneAsClosed() {
            CustomSchedule mars = weekdays().withTimezone("Mars/Olympus");

            assertThat(evaluator.isInWindow(lima(3, 10, 0), mars)).isFalse();
            assertThat(evaluator.isInWindow(lima(3, 10, 0), weekdays().withTimezone(" ")))
                    .isFalse();
            assertThat(evaluator.isInWindow(lima(3, 10, 0), null)).isFalse();
        }

        @Test
        void shouldIgnoreWindowsWithMalformedTimes() {
            TimeWindow window =
                    new TimeWindow(EnumSet.allOf(DayOfWeek.class), "9:00", "18:00", false);
            CustomSchedule schedule = new CustomSchedule(LIMA, List.of(window), List.of());

            assertThat(evaluator.isInWindow(lima(3, 10, 0), schedule)).isFalse();
        }
    }

    @Nested
    @DisplayName("nextOpening")
    class NextOpening {

        @Test
        void shouldFindMondayMorningFromSaturday() {
            // Given
            Instant saturday = lima(8, 10, 0);

            // When
            Optional<ScheduleOpening> opening = evaluator.nextOpening(saturday, weekdays());

            // Then
            assertThat(opening).isPresent();
            assertThat(opening.get().at()).isEqualTo(Instant.parse("2024-06-10T14:00:00Z"));
            assertThat(opening.get().date()).isEqualTo(LocalDate.of(2024, 6, 10));
            assertThat(opening.get().weekday()).isEqualTo(DayOfWeek.MONDAY);
            assertThat(evaluator.formatNextOpening(opening.get())).isEqualTo("Mon · 09:00");
        }

        @Test
        void shouldReturnStartWhenAlreadyOpen() {
            Instant from = lima(3, 11, 17);

            Optional<ScheduleOpening> opening = evaluator.nextOpening(from, weekdays());

            assertThat(opening.map(ScheduleOpening::at)).contains(from);
        }

        @Test
        void shouldAttributeOvernightTailToStartingDay() {
            Instant from = lima(8, 5, 0);

            ScheduleOpening opening = evaluator.nextOpening(from, fridayNight()).orElseThrow();

            assertThat(opening.at()).isEqualTo(from);
            assertThat(opening.weekday()).isEqualTo(DayOfWeek.FRIDAY);
            assertThat(opening.overnight()).isTrue();
            assertThat(evaluator.formatNextOpening(opening)).isEqualTo("Fri · 22:00");
        }

        @Test
        void shouldFindEarliestOpenMinute() {
            // Given
            CustomSchedule schedule =
                    new CustomSchedule(
                            LIMA,
                            List.of(
                                    TimeWindow.defaultWindow(),
                                    window(DayOfWeek.SATURDAY, "10:00", "12:00", false),
                                    window(DayOfWeek.SUNDAY, "23:00", "01:00", true)),
                            List.of(new DateException("2024-06-10", true, null, null)));
            List<Instant> starts =
                    List.of(lima(7, 18, 0), lima(8, 12, 30), lima(9, 22, 59), lima(10, 1, 0));

            for (Instant from : starts) {
                // When
                Instant found = evaluator.nextOpening(from, schedule).orElseThrow().at();

                // Then
                Instant brute = from;
                while (!evaluator.isInWindow(brute, schedule)) {
                    brute = brute.plus(Duration.ofMinutes(1));
                }
                assertThat(found).as("next opening from %s", from).isEqualTo(brute);
            }
        }

        @Test
        void shouldOpenAtTransitionWhenStartFallsInSpringForwardGap() {
            // Given
            // New York skips 02:00-03:00 local time on 2024-03-10
            CustomSchedule schedule =
                    new CustomSchedule(
                            "America/New_York",
                            List.of(window(DayOfWeek.SUNDAY, "02:30", "12:45", false)),
                            List.of());
            Instant from = Instant.parse("2024-03-10T04:43:51Z");

            // When
            Instant found = evaluator.nextOpening(from, schedule).orElseThrow().at();

            // Then
            assertThat(found).isEqualTo(Instant.parse("2024-03-10T07:00:00Z"));
            assertThat(evaluator.isInWindow(found, schedule)).isTrue();
            assertThat(evaluator.isInWindow(found.minusSeconds(1), schedule)).isFalse();
        }

        @Test
        void shouldSkipWindowLyingEntirelyInSpringForwardGap() {
            CustomSchedule schedule =
                    new CustomSchedule(
                            "America/New_York",
                            List.of(window(DayOfWeek.SUNDAY, "02:00", "02:45", false)),
                            List.of());

            Optional<ScheduleOpening> opening =
                    evaluator.nextOpening(Instant.parse("2024-03-10T04:43:51Z"), schedule);

            assertThat(opening)
                    .map(ScheduleOpening::at)
                    .contains(Instant.parse("2024-03-17T06:00:00Z"));
        }

        @Test
        void shouldReturnEmptyWhenNothingOpensWithinHorizon() {
            TimeWindow never = new TimeWindow(Set.of(), "09:00", "18:00", false);
            CustomSchedule schedule = new CustomSchedule(LIMA, List.of(never), List.of());

            assertThat(evaluator.nextOpening(lima(3, 10, 0), schedule)).isEmpty();
            assertThat(new ScheduleEvaluator(0).nextOpening(lima(8, 10, 0), weekdays()))
                    .isEmpty();
            assertThat(evaluator.nextOpening(lima(3, 10, 0), weekdays().withTimezone("Nowhere")))
                    .isEmpty();
            assertThat(evaluator.formatNextOpening(null)).isNull();
        }

        @Test
        void shouldRejectNegativeHorizon() {
            assertThatThrownBy(() -> new ScheduleEvaluator(-1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("-1");
        }
    }

    @Nested
    @DisplayName("validateCustomSchedule")
    class Validate {

        @Test
        void shouldAcceptDefaultSchedule() {
            assertThat(evaluator.validateCustomSchedule(weekdays())).isEmpty();
            assertThat(evaluator.validateCustomSchedule(fridayNight())).isEmpty();
        }

        @Test
        void shouldAskForScheduleWhenMissing() {
            assertThat(evaluator.validateCustomSchedule(null))
                    .containsExactly("Configure a custom schedule.");
        }

        @Test
        void shouldReportProblemsInDocumentOrder() {
            // Given
            CustomSchedule schedule =
                    new CustomSchedule(
                            "",
                            List.of(
                                    new TimeWindow(Set.of(), "9:00", "18:00", false),
                                    new TimeWindow(
                                            EnumSet.of(DayOfWeek.MONDAY), "18:00", "09:00", false)),
                            List.of(
                                    new DateException("2024-13-01", false, "10:00", null),
                                    new DateException("2024-06-03", false, "10:00", "25:00")));

            // When
            List<String> errors = evaluator.validateCustomSchedule(schedule);

            // Then
            assertThat(errors)
                    .containsExactly(
                            "Select a timezone",
                            "Window 1: invalid start time",
                            "Window 1: select at least one weekday",
                            "Window 2: start must be before end (or mark it overnight)",
                            "Exception 1: invalid date",
                            "Exception 1: missing start or end",
                            "Exception 2: invalid end time");
        }

        @Test
        void shouldReportUnknownTimezoneAndMissingWindows() {
            CustomSchedule schedule = new CustomSchedule("Mars/Olympus", List.of(), List.of());

            assertThat(evaluator.validateCustomSchedule(schedule))
                    .containsExactly(
                            "Unknown timezone: Mars/Olympus", "Add at least one time window");
        }
    }
}
