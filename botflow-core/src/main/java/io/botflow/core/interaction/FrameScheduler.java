package io.botflow.core.interaction;

/// Host hook that runs a callback on the next animation frame.
public interface FrameScheduler {

    /// Schedules a callback for the next frame.
    ///
    /// @param callback work to run, not null
    /// @return handle for {@link #cancelFrame(long)}
    long requestFrame(Runnable callback);

    /// Cancels a scheduled callback. Unknown or already-run handles are ignored.
    void cancelFrame(long handle);
}
