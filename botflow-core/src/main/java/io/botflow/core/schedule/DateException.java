package io.botflow.core.schedule;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/// Calendar-date override of the regular windows.
///
/// A closed exception shuts the whole day. Otherwise, when both `start` and `end` are set,
/// they replace every regular window of that date. An exception with neither is ignored.
///
/// @param date ISO local date (`yyyy-MM-dd`) in the schedule's timezone
/// @param closed whether the business is closed all day
/// @param start override opening time, or null
/// @param end override closing time, or null
public record DateException(String date, boolean closed, String start, String end) {

    /// Parses {@link #date()}.
    ///
    /// @return the date, or empty when it is missing or malformed
    public Optional<LocalDate> localDate() {
        if (date == null || date.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(date.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    boolean hasOverrideHours() {
        return start != null && !start.isBlank() && end != null && !end.isBlank();
    }
}
