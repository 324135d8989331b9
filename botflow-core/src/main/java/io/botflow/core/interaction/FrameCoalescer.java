package io.botflow.core.interaction;

import java.util.Objects;

/// Runs gesture-driven recomputation at most once per animation frame.
///
/// Requests made before the frame fires replace each other; only the latest task runs.
/// {@link #cancel()} drops the pending task and the frame request, so nothing from before
/// the cancel runs afterwards, even if the host fires a frame it was asked to cancel.
///
/// @implNote **Not thread-safe**. Confine to the UI thread that owns the frame scheduler.
public final class FrameCoalescer {

    private final FrameScheduler scheduler;
    private Runnable pending;
    private boolean scheduled;
    private long frameHandle;
    private long generation;

    public FrameCoalescer(FrameScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /// Queues work for the next frame, replacing any task queued earlier.
    ///
    /// @param task work to run, not null
    public void request(Runnable task) {
        pending = Objects.requireNonNull(task, "task must not be null");
        if (!scheduled) {
            scheduled = true;
            long frameGeneration = generation;
            frameHandle = scheduler.requestFrame(() -> runFrame(frameGeneration));
        }
    }

    /// Discards the pending task and cancels the frame request.
    public void cancel() {
        if (scheduled) {
            scheduler.cancelFrame(frameHandle);
        }
        generation++;
        scheduled = false;
        pending = null;
    }

    public boolean isPending() {
        return scheduled;
    }

    private void runFrame(long frameGeneration) {
        if (!scheduled || frameGeneration != generation) {
            return;
        }
        Runnable task = pending;
        pending = null;
        scheduled = false;
        generation++;
        task.run();
    }
}
