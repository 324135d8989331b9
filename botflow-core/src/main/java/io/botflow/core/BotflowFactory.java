package io.botflow.core;

import io.botflow.core.edit.FlowOperations;
import io.botflow.core.handle.HandleAssignment;
import io.botflow.core.kind.NodeKindRegistry;
import io.botflow.core.kind.PayloadDefaults;
import io.botflow.core.normalize.FlowNormalizer;
import io.botflow.core.schedule.ScheduleEvaluator;
import io.botflow.core.storage.FlowSnapshotRepository;
import io.botflow.core.storage.InMemoryFlowSnapshotRepository;
import io.botflow.core.validation.FlowValidator;
import java.util.Objects;

/// Factory for creating and wiring {@link BotflowEnvironment} instances.
///
/// ### Usage
/// {@snippet :
/// var env = BotflowFactory.createEnvironment(BotflowConfig.load("botflow.properties"));
/// EditResult result = env.getOperations().addChildTo(flow, flow.getRootId(), NodeKind.MESSAGE);
/// }
///
/// @see BotflowEnvironment
/// @see BotflowConfig
public final class BotflowFactory {

    private BotflowFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration and in-memory storage.
    ///
    /// @return a fully-configured environment, never null
    public static BotflowEnvironment createEnvironment() {
        return createEnvironment(new BotflowConfig());
    }

    /// Creates an environment with custom configuration and in-memory storage.
    ///
    /// @param config configuration options, not null
    /// @return a fully-configured environment, never null
    public static BotflowEnvironment createEnvironment(BotflowConfig config) {
        return createEnvironment(config, new InMemoryFlowSnapshotRepository());
    }

    /// Creates an environment with custom configuration and storage.
    ///
    /// This is the primary factory method that other overloads delegate to.
    ///
    /// @param config configuration options, not null
    /// @param snapshotRepository workspace storage, not null
    /// @return a fully-configured environment, never null
    /// @throws IllegalArgumentException if the button limit is below 1 or the horizon is
    ///     negative
    public static BotflowEnvironment createEnvironment(
            BotflowConfig config, FlowSnapshotRepository snapshotRepository) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(snapshotRepository, "snapshotRepository must not be null");

        PayloadDefaults defaults =
                new PayloadDefaults(config.getDefaultTimezone(), config.getDefaultButtonLimit());
        NodeKindRegistry registry = new NodeKindRegistry(defaults);
        FlowNormalizer normalizer = new FlowNormalizer(registry);
        HandleAssignment handleAssignment = new HandleAssignment(registry);
        FlowOperations operations = new FlowOperations(registry, normalizer, handleAssignment);
        ScheduleEvaluator scheduleEvaluator = new ScheduleEvaluator(config.getOpeningHorizonDays());
        FlowValidator validator = new FlowValidator(registry, scheduleEvaluator);

        return new BotflowEnvironment(
                config,
                registry,
                normalizer,
                handleAssignment,
                operations,
                scheduleEvaluator,
                validator,
                snapshotRepository);
    }
}
