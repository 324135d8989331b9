package io.botflow.core.schedule;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.time.zone.ZoneRules;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/// Business-hours evaluation for scheduler nodes.
///
/// ### Matching rule
/// An instant is resolved to wall-clock time in the schedule's timezone, then:
/// 1. the windows *of that date* are collected: a closed exception yields none, an
///    exception with start and end yields exactly that span, otherwise every regular
///    window whose weekday set contains the date's weekday;
/// 2. the time matches a collected span when it lies in `[start, end)`, or, for an
///    overnight span, when it is at or after `start`;
/// 3. failing that, the overnight spans of the *previous* date (collected the same way)
///    match when the time is before their `end`.
///
/// A window with `end < start` is treated as overnight whether or not it is flagged.
///
/// ### Failure behavior
/// Nothing here throws on bad schedule data. An unresolvable timezone makes the schedule
/// closed (logged as a warning); malformed times make their window inert. Use
/// {@link #validateCustomSchedule(CustomSchedule)} to surface such problems.
///
/// @implNote Stateless and thread-safe.
public class ScheduleEvaluator {

    private static final Logger logger = Logger.getLogger(ScheduleEvaluator.class.getName());

    public static final int DEFAULT_HORIZON_DAYS = 14;

    private final int horizonDays;

    public ScheduleEvaluator() {
        this(DEFAULT_HORIZON_DAYS);
    }

    /// @param horizonDays how many days past the current one {@link #nextOpening} scans
    /// @throws IllegalArgumentException if `horizonDays` is negative
    public ScheduleEvaluator(int horizonDays) {
        if (horizonDays < 0) {
            throw new IllegalArgumentException("Horizon must not be negative: " + horizonDays);
        }
        this.horizonDays = horizonDays;
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    /// Checks whether the schedule is open at an instant.
    ///
    /// @param instant point in time, not null
    /// @param schedule schedule to evaluate, may be null (always closed)
    /// @return true if open
    public boolean isInWindow(Instant instant, CustomSchedule schedule) {
        if (schedule == null) {
            return false;
        }
        Optional<ZoneId> zone = resolveZone(schedule.timezone());
        if (zone.isEmpty()) {
            return false;
        }
        ZonedDateTime local = instant.atZone(zone.get());
        return findOpenSpan(local.toLocalDate(), minuteOfDay(local), schedule).isPresent();
    }

    /// Finds the earliest instant at or after `from` at which the schedule is open.
    ///
    /// Returns `from` itself when the schedule is already open. Otherwise the window starts
    /// of the current date and the following {@link #getHorizonDays()} dates are tried in
    /// chronological order.
    ///
    /// @param from search start, not null
    /// @param schedule schedule to evaluate, may be null
    /// @return the opening, or empty when none falls within the horizon
    public Optional<ScheduleOpening> nextOpening(Instant from, CustomSchedule schedule) {
        if (schedule == null) {
            return Optional.empty();
        }
        Optional<ZoneId> zone = resolveZone(schedule.timezone());
        if (zone.isEmpty()) {
            return Optional.empty();
        }
        ZonedDateTime local = from.atZone(zone.get());
        LocalDate today = local.toLocalDate();

        Optional<DatedSpan> current = findOpenSpan(today, minuteOfDay(local), schedule);
        if (current.isPresent()) {
            return Optional.of(current.get().toOpening(from));
        }

        for (int offset = 0; offset <= horizonDays; offset++) {
            LocalDate day = today.plusDays(offset);
            List<Span> spans = new ArrayList<>(spansFor(day, schedule));
            spans.sort(Comparator.comparingInt(Span::start));
            for (Span span : spans) {
                Instant candidate = startInstant(day, span.start(), zone.get());
                if (!candidate.isBefore(from) && isInWindow(candidate, schedule)) {
                    return Optional.of(new DatedSpan(day, span).toOpening(candidate));
                }
            }
        }
        return Optional.empty();
    }

    /// Renders an opening as `"<weekday> · <start>"`, e.g. `"Mon · 09:00"`.
    ///
    /// @param opening opening to format, may be null
    /// @return formatted text, or null when `opening` is null
    public String formatNextOpening(ScheduleOpening opening) {
        if (opening == null) {
            return null;
        }
        return opening.weekday().getDisplayName(TextStyle.SHORT, Locale.ENGLISH)
                + " · "
                + opening.start();
    }

    /// Structural validation of a custom schedule.
    ///
    /// @param schedule schedule to check, may be null
    /// @return human-readable problems in document order, empty when valid, never null
    public List<String> validateCustomSchedule(CustomSchedule schedule) {
        List<String> errors = new ArrayList<>();
        if (schedule == null) {
            errors.add("Configure a custom schedule.");
            return errors;
        }
        String timezone = schedule.timezone();
        if (timezone == null || timezone.isBlank()) {
            errors.add("Select a timezone");
        } else if (!isKnownZone(timezone)) {
            errors.add("Unknown timezone: " + timezone);
        }
        if (schedule.windows().isEmpty()) {
            errors.add("Add at least one time window");
        }

        int index = 0;
        for (TimeWindow window : schedule.windows()) {
            index++;
            OptionalInt start = ClockTime.parseMinutes(window.start());
            OptionalInt end = ClockTime.parseMinutes(window.end());
            if (start.isEmpty()) {
                errors.add("Window " + index + ": invalid start time");
            }
            if (end.isEmpty()) {
                errors.add("Window " + index + ": invalid end time");
            }
            if (start.isPresent()
                    && end.isPresent()
                    && start.getAsInt() >= end.getAsInt()
                    && !window.overnight()) {
                errors.add(
                        "Window " + index + ": start must be before end (or mark it overnight)");
            }
            if (window.weekdays() == null || window.weekdays().isEmpty()) {
                errors.add("Window " + index + ": select at least one weekday");
            }
        }

        index = 0;
        for (DateException exception : schedule.exceptions()) {
            index++;
            if (exception.localDate().isEmpty()) {
                errors.add("Exception " + index + ": invalid date");
            }
            if (exception.closed()) {
                continue;
            }
            boolean hasStart = exception.start() != null && !exception.start().isBlank();
            boolean hasEnd = exception.end() != null && !exception.end().isBlank();
            if (hasStart != hasEnd) {
                errors.add("Exception " + index + ": missing start or end");
            }
            if (hasStart && !ClockTime.isValid(exception.start())) {
                errors.add("Exception " + index + ": invalid start time");
            }
            if (hasEnd && !ClockTime.isValid(exception.end())) {
                errors.add("Exception " + index + ": invalid end time");
            }
        }
        return errors;
    }

    private Optional<DatedSpan> findOpenSpan(LocalDate day, int minute, CustomSchedule schedule) {
        for (Span span : spansFor(day, schedule)) {
            boolean open =
                    span.overnight()
                            ? minute >= span.start()
                            : minute >= span.start() && minute < span.end();
            if (open) {
                return Optional.of(new DatedSpan(day, span));
            }
        }
        LocalDate previous = day.minusDays(1);
        for (Span span : spansFor(previous, schedule)) {
            if (span.overnight() && minute < span.end()) {
                return Optional.of(new DatedSpan(previous, span));
            }
        }
        return Optional.empty();
    }

    private List<Span> spansFor(LocalDate day, CustomSchedule schedule) {
        Optional<DateException> exception = schedule.exceptionFor(day);
        if (exception.isPresent()) {
            DateException override = exception.get();
            if (override.closed()) {
                return List.of();
            }
            if (override.hasOverrideHours()) {
                return Span.parse(override.start(), override.end(), false)
                        .map(List::of)
                        .orElse(List.of());
            }
        }
        DayOfWeek weekday = day.getDayOfWeek();
        List<Span> spans = new ArrayList<>();
        for (TimeWindow window : schedule.windows()) {
            if (window.opensOn(weekday)) {
                Span.parse(window.start(), window.end(), window.overnight()).ifPresent(spans::add);
            }
        }
        return spans;
    }

    /// Resolves a wall-clock start to an instant. A start inside a daylight-saving gap
    /// resolves to the transition, the first instant whose local time is past it.
    private static Instant startInstant(LocalDate day, int minute, ZoneId zone) {
        LocalDateTime local = day.atTime(minute / 60, minute % 60);
        ZoneRules rules = zone.getRules();
        if (rules.getValidOffsets(local).isEmpty()) {
            return rules.getTransition(local).getInstant();
        }
        return local.atZone(zone).toInstant();
    }

    private static int minuteOfDay(ZonedDateTime local) {
        return local.getHour() * 60 + local.getMinute();
    }

    private static boolean isKnownZone(String timezone) {
        try {
            ZoneId.of(timezone.trim());
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    private static Optional<ZoneId> resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            logger.warning("Schedule has no timezone; treating it as closed");
            return Optional.empty();
        }
        try {
            return Optional.of(ZoneId.of(timezone.trim()));
        } catch (DateTimeException e) {
            logger.warning("Unknown schedule timezone '" + timezone + "': " + e.getMessage());
            return Optional.empty();
        }
    }

    private record Span(int start, int end, String startText, String endText, boolean overnight) {

        static Optional<Span> parse(String start, String end, boolean overnightFlag) {
            OptionalInt startMinutes = ClockTime.parseMinutes(start);
            OptionalInt endMinutes = ClockTime.parseMinutes(end);
            if (startMinutes.isEmpty() || endMinutes.isEmpty()) {
                return Optional.empty();
            }
            int s = startMinutes.getAsInt();
            int e = endMinutes.getAsInt();
            return Optional.of(new Span(s, e, start.trim(), end.trim(), overnightFlag || s > e));
        }
    }

    private record DatedSpan(LocalDate day, Span span) {

        ScheduleOpening toOpening(Instant at) {
            return new ScheduleOpening(
                    at,
                    day,
                    day.getDayOfWeek(),
                    span.startText(),
                    span.endText(),
                    span.overnight());
        }
    }
}
