package io.botflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.botflow.core.edit.EditResult;
import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.NodeType;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.kind.NodeKind;
import io.botflow.core.storage.FlowSnapshotRepository;
import io.botflow.core.storage.InMemoryFlowSnapshotRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BotflowFactory")
class BotflowFactoryTest {

    private static Flow emptyMenu() {
        return Flow.builder()
                .id("support")
                .name("Support")
                .rootId("root")
                .node(FlowNode.builder().id("root").label("Main").type(NodeType.MENU).build())
                .build();
    }

    @Test
    void shouldWireDefaultEnvironment() {
        BotflowEnvironment env = BotflowFactory.createEnvironment();

        assertThat(env.getConfig().getDefaultTimezone()).isEqualTo("America/Lima");
        assertThat(env.getRegistry()).isNotNull();
        assertThat(env.getNormalizer()).isNotNull();
        assertThat(env.getHandleAssignment()).isNotNull();
        assertThat(env.getValidator()).isNotNull();
        assertThat(env.getSnapshotRepository()).isInstanceOf(InMemoryFlowSnapshotRepository.class);
    }

    @Test
    void shouldApplyConfiguredDefaultsToNewNodes() {
        // Given
        BotflowConfig config =
                BotflowConfig.builder()
                        .defaultTimezone("Europe/Madrid")
                        .defaultButtonLimit(5)
                        .openingHorizonDays(3)
                        .build();
        BotflowEnvironment env = BotflowFactory.createEnvironment(config);

        // When
        EditResult buttons = env.getOperations().addChildTo(emptyMenu(), "root", NodeKind.BUTTONS);
        EditResult scheduler =
                env.getOperations().addChildTo(buttons.flow(), "root", NodeKind.SCHEDULER);

        // Then
        ButtonsPayload payload =
                (ButtonsPayload) buttons.flow().getNode(buttons.createdNodeId()).getAction();
        assertThat(payload.maxButtons()).isEqualTo(5);
        SchedulerPayload schedule =
                (SchedulerPayload)
                        scheduler.flow().getNode(scheduler.createdNodeId()).getAction();
        assertThat(schedule.custom().timezone()).isEqualTo("Europe/Madrid");
        assertThat(env.getScheduleEvaluator().getHorizonDays()).isEqualTo(3);
    }

    @Test
    void shouldUseGivenSnapshotRepository() {
        FlowSnapshotRepository repository = mock(FlowSnapshotRepository.class);

        BotflowEnvironment env =
                BotflowFactory.createEnvironment(new BotflowConfig(), repository);

        assertThat(env.getSnapshotRepository()).isSameAs(repository);
    }

    @Test
    void shouldRejectMissingArguments() {
        assertThatThrownBy(() -> BotflowFactory.createEnvironment(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("config must not be null");
        assertThatThrownBy(
                        () -> BotflowFactory.createEnvironment(new BotflowConfig(), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("snapshotRepository must not be null");
    }

    @Test
    void shouldRejectNonPositiveButtonLimit() {
        BotflowConfig config = BotflowConfig.builder().defaultButtonLimit(0).build();

        assertThatThrownBy(() -> BotflowFactory.createEnvironment(config))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
