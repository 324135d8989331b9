package io.botflow.core.schedule;

import java.util.OptionalInt;
import java.util.regex.Pattern;

/// Parsing of `HH:MM` wall-clock strings used by time windows and date exceptions.
///
/// Only the strict two-digit form is accepted (`"09:00"`, not `"9:00"`), hours `00`-`23`,
/// minutes `00`-`59`. Surrounding whitespace is ignored.
public final class ClockTime {

    private static final Pattern HH_MM = Pattern.compile("\\d{2}:\\d{2}");

    private ClockTime() {}

    /// Converts a clock string to minutes after midnight.
    ///
    /// @param value clock string, may be null
    /// @return minutes in `[0, 1440)`, or empty if the value is malformed
    public static OptionalInt parseMinutes(String value) {
        if (value == null) {
            return OptionalInt.empty();
        }
        String trimmed = value.trim();
        if (!HH_MM.matcher(trimmed).matches()) {
            return OptionalInt.empty();
        }
        int hours = Integer.parseInt(trimmed.substring(0, 2));
        int minutes = Integer.parseInt(trimmed.substring(3, 5));
        if (hours > 23 || minutes > 59) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(hours * 60 + minutes);
    }

    public static boolean isValid(String value) {
        return parseMinutes(value).isPresent();
    }
}
