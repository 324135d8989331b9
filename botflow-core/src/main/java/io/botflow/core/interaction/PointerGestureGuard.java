package io.botflow.core.interaction;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Enforces one gesture per input pointer.
///
/// A pointer that already owns a gesture cannot start another one until the first is
/// completed or cancelled. Different pointers are independent.
///
/// @implNote Thread-safe.
public final class PointerGestureGuard {

    private static final Logger logger = Logger.getLogger(PointerGestureGuard.class.getName());

    private final Map<Integer, GestureKind> active = new ConcurrentHashMap<>();

    /// Claims a pointer for a gesture.
    ///
    /// @param pointerId input pointer identifier
    /// @param kind gesture to start, not null
    /// @return true if the gesture started, false if the pointer is busy
    public boolean begin(int pointerId, GestureKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        GestureKind previous = active.putIfAbsent(pointerId, kind);
        if (previous != null && logger.isLoggable(Level.FINE)) {
            logger.fine(
                    "Pointer " + pointerId + " busy with " + previous + "; rejected " + kind);
        }
        return previous == null;
    }

    /// Ends a gesture normally.
    ///
    /// @param pointerId input pointer identifier
    /// @param kind gesture being completed
    /// @return true if that gesture was active on the pointer
    public boolean complete(int pointerId, GestureKind kind) {
        return active.remove(pointerId, kind);
    }

    /// Abandons whatever gesture the pointer owns.
    ///
    /// @param pointerId input pointer identifier
    /// @return the cancelled gesture, or empty if the pointer was idle
    public Optional<GestureKind> cancel(int pointerId) {
        return Optional.ofNullable(active.remove(pointerId));
    }

    public Optional<GestureKind> activeGesture(int pointerId) {
        return Optional.ofNullable(active.get(pointerId));
    }
}
