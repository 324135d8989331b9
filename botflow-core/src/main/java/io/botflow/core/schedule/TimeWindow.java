package io.botflow.core.schedule;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/// Recurring opening hours on a set of weekdays.
///
/// A window whose end is before its start straddles midnight and is evaluated as
/// overnight even when the flag is not set; the part after midnight belongs to the
/// following calendar day.
///
/// @param weekdays days the window opens on; null until normalized
/// @param start opening time, `HH:MM`
/// @param end closing time, `HH:MM`, exclusive
/// @param overnight whether the window continues past midnight
public record TimeWindow(Set<DayOfWeek> weekdays, String start, String end, boolean overnight) {

    public static final String DEFAULT_START = "09:00";
    public static final String DEFAULT_END = "18:00";

    public TimeWindow {
        if (weekdays != null) {
            weekdays =
                    weekdays.isEmpty()
                            ? Set.of()
                            : Collections.unmodifiableSet(EnumSet.copyOf(weekdays));
        }
    }

    /// Monday to Friday, 09:00 to 18:00.
    public static TimeWindow defaultWindow() {
        return new TimeWindow(
                EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY),
                DEFAULT_START,
                DEFAULT_END,
                false);
    }

    public boolean opensOn(DayOfWeek day) {
        return weekdays != null && weekdays.contains(day);
    }
}
