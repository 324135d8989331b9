package io.botflow.core.schedule;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Business hours owned by a scheduler node.
///
/// @param timezone IANA zone id the windows are expressed in
/// @param windows regular weekly windows, never null
/// @param exceptions per-date overrides, never null
public record CustomSchedule(
        String timezone, List<TimeWindow> windows, List<DateException> exceptions) {

    public CustomSchedule {
        windows = copyWithoutNulls(windows);
        exceptions = copyWithoutNulls(exceptions);
    }

    /// One default window in the given timezone and no exceptions.
    public static CustomSchedule defaultSchedule(String timezone) {
        return new CustomSchedule(timezone, List.of(TimeWindow.defaultWindow()), List.of());
    }

    /// Finds the first exception declared for a date.
    public Optional<DateException> exceptionFor(LocalDate day) {
        for (DateException exception : exceptions) {
            if (exception.localDate().filter(day::equals).isPresent()) {
                return Optional.of(exception);
            }
        }
        return Optional.empty();
    }

    public CustomSchedule withTimezone(String newTimezone) {
        return new CustomSchedule(newTimezone, windows, exceptions);
    }

    private static <T> List<T> copyWithoutNulls(List<T> source) {
        if (source == null) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(source.size());
        for (T element : source) {
            if (element != null) {
                copy.add(element);
            }
        }
        return List.copyOf(copy);
    }
}
