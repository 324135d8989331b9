package io.botflow.core.schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;

/// Result of a next-opening search.
///
/// @param at earliest instant the schedule is open
/// @param date local calendar date the matching window starts on
/// @param weekday weekday of `date`
/// @param start window start, `HH:MM`
/// @param end window end, `HH:MM`
/// @param overnight whether the window continues past midnight
public record ScheduleOpening(
        Instant at,
        LocalDate date,
        DayOfWeek weekday,
        String start,
        String end,
        boolean overnight) {}
