package io.botflow.core;

import io.botflow.core.edit.FlowOperations;
import io.botflow.core.handle.HandleAssignment;
import io.botflow.core.kind.NodeKindRegistry;
import io.botflow.core.normalize.FlowNormalizer;
import io.botflow.core.schedule.ScheduleEvaluator;
import io.botflow.core.storage.FlowSnapshotRepository;
import io.botflow.core.validation.FlowValidator;

/// Container holding the wired flow editing components.
///
/// @implNote All fields are final and set at construction time; every contained
/// component is stateless except the repository, which is thread-safe.
///
/// @apiNote Create instances via {@link BotflowFactory#createEnvironment()} rather than
/// direct construction.
public final class BotflowEnvironment {

    private final BotflowConfig config;
    private final NodeKindRegistry registry;
    private final FlowNormalizer normalizer;
    private final HandleAssignment handleAssignment;
    private final FlowOperations operations;
    private final ScheduleEvaluator scheduleEvaluator;
    private final FlowValidator validator;
    private final FlowSnapshotRepository snapshotRepository;

    public BotflowEnvironment(
            BotflowConfig config,
            NodeKindRegistry registry,
            FlowNormalizer normalizer,
            HandleAssignment handleAssignment,
            FlowOperations operations,
            ScheduleEvaluator scheduleEvaluator,
            FlowValidator validator,
            FlowSnapshotRepository snapshotRepository) {
        this.config = config;
        this.registry = registry;
        this.normalizer = normalizer;
        this.handleAssignment = handleAssignment;
        this.operations = operations;
        this.scheduleEvaluator = scheduleEvaluator;
        this.validator = validator;
        this.snapshotRepository = snapshotRepository;
    }

    public BotflowConfig getConfig() {
        return config;
    }

    public NodeKindRegistry getRegistry() {
        return registry;
    }

    public FlowNormalizer getNormalizer() {
        return normalizer;
    }

    public HandleAssignment getHandleAssignment() {
        return handleAssignment;
    }

    public FlowOperations getOperations() {
        return operations;
    }

    public ScheduleEvaluator getScheduleEvaluator() {
        return scheduleEvaluator;
    }

    public FlowValidator getValidator() {
        return validator;
    }

    /// Returns the workspace snapshot storage.
    ///
    /// @return repository, never null
    public FlowSnapshotRepository getSnapshotRepository() {
        return snapshotRepository;
    }
}
