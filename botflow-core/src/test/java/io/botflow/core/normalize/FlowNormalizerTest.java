package io.botflow.core.normalize;

import static io.botflow.core.FlowFixtures.buttons;
import static io.botflow.core.FlowFixtures.flow;
import static io.botflow.core.FlowFixtures.isConsistent;
import static io.botflow.core.FlowFixtures.menu;
import static io.botflow.core.FlowFixtures.message;
import static io.botflow.core.FlowFixtures.option;
import static org.assertj.core.api.Assertions.assertThat;

import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.NodeType;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.AskValidation;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.MessagePayload;
import io.botflow.core.flow.action.OpaquePayload;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.kind.NodeKind;
import io.botflow.core.kind.NodeKindRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FlowNormalizer")
class FlowNormalizerTest {

    private final NodeKindRegistry registry = new NodeKindRegistry();
    private final FlowNormalizer normalizer = new FlowNormalizer(registry);

    @Nested
    @DisplayName("identity and idempotence")
    class Idempotence {

        @Test
        void shouldReturnSameInstanceForCanonicalFlow() {
            // Given
            Flow canonical =
                    normalizer.normalize(
                            flow(
                                    "root",
                                    menu("root", option("menu-1", "1")),
                                    buttons("1", 3, "2", null),
                                    message("2", null)));

            // When / Then
            assertThat(normalizer.normalize(canonical)).isSameAs(canonical);
        }

        @Test
        void shouldBeIdempotentOnRawInput() {
            Flow raw =
                    flow(
                            "root",
                            menu("root"),
                            FlowNode.builder().id("a").type(NodeType.ACTION).build(),
                            buttons("b", 0, "a", "ghost", null, "a"));

            Flow once = normalizer.normalize(raw);

            assertThat(normalizer.normalize(once)).isSameAs(once);
            assertThat(isConsistent(registry, once)).isTrue();
        }

        @Test
        void shouldKeepUnchangedNodeInstances() {
            FlowNode canonical = registry.createNode("1", NodeKind.MESSAGE);
            Flow raw = flow("root", menu("root", option("menu-1", "1")), canonical);

            Flow normalized = normalizer.normalize(raw);

            assertThat(normalized).isNotSameAs(raw);
            assertThat(normalized.getNode("1")).isSameAs(canonical);
        }
    }

    @Test
    void shouldFillOneDefaultOptionForEmptyMenu() {
        Flow raw = flow("root", menu("root"));

        FlowNode root = normalizer.normalize(raw).getRoot();

        assertThat(root.getMenuOptions())
                .containsExactly(new MenuOption("menu-1", "Option 1", null, null));
        assertThat(root.getChildren()).isEmpty();
    }

    @Test
    void shouldDeriveChildrenFromHandleTargets() {
        FlowNode root =
                menu("root", option("a", "2"), option("b", "1"), option("c", "2"))
                        .toBuilder()
                        .children(List.of("stale", "1"))
                        .build();
        Flow raw = flow("root", root, message("1", null), message("2", null));

        assertThat(normalizer.normalize(raw).getRoot().getChildren()).containsExactly("2", "1");
    }

    @Test
    void shouldClearDanglingTargets() {
        // Given
        Flow raw =
                flow(
                        "root",
                        menu("root", option("a", "ghost"), option("b", "1")),
                        message("1", "ghost"));

        // When
        Flow normalized = normalizer.normalize(raw);

        // Then
        assertThat(normalized.getRoot().getMenuOptions().get(0).targetId()).isNull();
        assertThat(normalized.getRoot().getChildren()).containsExactly("1");
        assertThat(normalized.getNode("1").getChildren()).isEmpty();
        assertThat(isConsistent(registry, normalized)).isTrue();
    }

    @Test
    void shouldGiveActionWithoutPayloadAnEmptyMessage() {
        FlowNode bare = FlowNode.builder().id("a").type(NodeType.ACTION).build();
        Flow raw = flow("root", menu("root"), bare);

        FlowNode node = normalizer.normalize(raw).getNode("a");

        assertThat(node.getAction()).isEqualTo(new MessagePayload(""));
        assertThat(node.getMenuOptions()).isEmpty();
    }

    @Test
    void shouldDropPayloadOfMenuNodeAndOptionsOfActionNode() {
        FlowNode menuWithAction =
                menu("root").toBuilder().action(new MessagePayload("stray")).build();
        FlowNode actionWithOptions =
                message("a", null).toBuilder()
                        .menuOptions(List.of(new MenuOption("x", "X", null, null)))
                        .build();

        Flow normalized = normalizer.normalize(flow("root", menuWithAction, actionWithOptions));

        assertThat(normalized.getRoot().getAction()).isNull();
        assertThat(normalized.getNode("a").getMenuOptions()).isEmpty();
    }

    @Test
    void shouldCompleteKindSpecificDefaults() {
        // Given
        FlowNode ask =
                FlowNode.builder()
                        .id("q")
                        .type(NodeType.ACTION)
                        .action(new AskPayload(null, null, null, null, null, null, null))
                        .build();
        FlowNode scheduler =
                FlowNode.builder()
                        .id("s")
                        .type(NodeType.ACTION)
                        .action(new SchedulerPayload(null, null, null, null))
                        .build();
        FlowNode emptyButtons = buttons("b", 0);

        // When
        Flow normalized =
                normalizer.normalize(flow("root", menu("root"), ask, scheduler, emptyButtons));

        // Then
        assertThat(((AskPayload) normalized.getNode("q").getAction()).validation())
                .isEqualTo(AskValidation.NONE);
        assertThat(((SchedulerPayload) normalized.getNode("s").getAction()).custom().windows())
                .hasSize(1);
        ButtonsPayload completed = (ButtonsPayload) normalized.getNode("b").getAction();
        assertThat(completed.items()).hasSize(1);
        assertThat(completed.maxButtons()).isEqualTo(3);
    }

    @Test
    void shouldTreatOpaquePayloadAsSingleHandle() {
        FlowNode condition =
                FlowNode.builder()
                        .id("c")
                        .type(NodeType.ACTION)
                        .action(new OpaquePayload("condition", Map.of("rules", List.of())))
                        .children(List.of("1", "2"))
                        .build();

        Flow normalized =
                normalizer.normalize(
                        flow(
                                "root",
                                menu("root"),
                                condition,
                                message("1", null),
                                message("2", null)));

        FlowNode node = normalized.getNode("c");
        assertThat(node.getAction()).isEqualTo(condition.getAction());
        assertThat(node.getChildren()).containsExactly("1");
    }
}
