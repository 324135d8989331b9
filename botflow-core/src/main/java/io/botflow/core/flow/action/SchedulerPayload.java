package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;
import io.botflow.core.schedule.CustomSchedule;

/// Business-hours branch: routes to one target inside the schedule and another outside.
///
/// @param mode schedule source; null until normalized
/// @param custom custom schedule; null until normalized
/// @param inWindowTargetId target of `out:schedule:in`, or null
/// @param outOfWindowTargetId target of `out:schedule:out`, or null
public record SchedulerPayload(
        SchedulerMode mode,
        CustomSchedule custom,
        String inWindowTargetId,
        String outOfWindowTargetId)
        implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.SCHEDULER;
    }

    public SchedulerPayload withInWindowTargetId(String target) {
        return new SchedulerPayload(mode, custom, target, outOfWindowTargetId);
    }

    public SchedulerPayload withOutOfWindowTargetId(String target) {
        return new SchedulerPayload(mode, custom, inWindowTargetId, target);
    }
}
