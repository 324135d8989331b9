package io.botflow.core.flow;

import static io.botflow.core.FlowFixtures.flow;
import static io.botflow.core.FlowFixtures.menu;
import static io.botflow.core.FlowFixtures.message;
import static io.botflow.core.FlowFixtures.option;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Flow")
class FlowTest {

    @Nested
    @DisplayName("builder")
    class BuilderTest {

        @Test
        void shouldBuildFlowWithDefaults() {
            Flow flow = Flow.builder().id("f").rootId("root").node(menu("root")).build();

            assertThat(flow.getVersion()).isEqualTo(1);
            assertThat(flow.getName()).isEmpty();
            assertThat(flow.getRoot().getId()).isEqualTo("root");
        }

        @Test
        void shouldRejectMissingRoot() {
            assertThatThrownBy(() -> Flow.builder().id("f").rootId("root").build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("root");
        }

        @Test
        void shouldRejectNullId() {
            assertThatThrownBy(() -> Flow.builder().rootId("root").node(menu("root")).build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("Flow ID required");
        }

        @Test
        void shouldRejectKeyThatDiffersFromNodeId() {
            assertThatThrownBy(
                            () ->
                                    Flow.builder()
                                            .id("f")
                                            .rootId("root")
                                            .nodes(Map.of("root", menu("other")))
                                            .build())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void shouldPreserveNodeInsertionOrder() {
            Flow flow = flow("root", menu("root"), message("b", null), message("a", null));

            assertThat(flow.getNodes().keySet()).containsExactly("root", "b", "a");
        }
    }

    @Test
    void shouldRoundTripThroughToBuilder() {
        Flow flow = flow("root", menu("root", option("menu-1", "1")), message("1", null));

        assertThat(flow.toBuilder().build()).isEqualTo(flow);
    }

    @Test
    void shouldAnswerNullForUnknownNode() {
        Flow flow = flow("root", menu("root"));

        assertThat(flow.getNode("missing")).isNull();
        assertThat(flow.getNode(null)).isNull();
        assertThat(flow.containsNode(null)).isFalse();
    }

    @Nested
    @DisplayName("FlowDocument")
    class FlowDocumentTest {

        @Test
        void shouldDropPositionsOfRemovedNodes() {
            // Given
            Flow before = flow("root", menu("root"), message("1", null));
            FlowDocument document =
                    new FlowDocument(
                            before,
                            Map.of("root", new NodePosition(0, 0), "1", new NodePosition(10, 20)));
            Flow after = flow("root", menu("root"));

            // When
            FlowDocument updated = document.withFlow(after);

            // Then
            assertThat(updated.flow()).isSameAs(after);
            assertThat(updated.positions()).containsOnlyKeys("root");
        }

        @Test
        void shouldReturnSameDocumentWhenNothingChanged() {
            Flow flow = flow("root", menu("root"));
            FlowDocument document = new FlowDocument(flow, Map.of("root", new NodePosition(1, 2)));

            assertThat(document.withFlow(flow)).isSameAs(document);
        }

        @Test
        void shouldTreatNullPositionsAsEmpty() {
            FlowDocument document = new FlowDocument(flow("root", menu("root")), null);

            assertThat(document.positions()).isEmpty();
        }
    }
}
