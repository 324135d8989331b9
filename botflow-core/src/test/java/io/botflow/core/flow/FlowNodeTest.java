package io.botflow.core.flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.OpaquePayload;
import io.botflow.core.kind.NodeKind;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FlowNode")
class FlowNodeTest {

    @Test
    void shouldDeduplicateChildrenAndDropNulls() {
        FlowNode node =
                FlowNode.builder()
                        .id("n")
                        .type(NodeType.ACTION)
                        .children(Arrays.asList("a", null, "b", "a"))
                        .build();

        assertThat(node.getChildren()).containsExactly("a", "b");
        assertThat(node.firstChild()).isEqualTo("a");
    }

    @Test
    void shouldRequireType() {
        assertThatThrownBy(() -> FlowNode.builder().id("n").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Node type required");
    }

    @Test
    void shouldDeriveKindFromTypeAndPayload() {
        FlowNode menu = FlowNode.builder().id("m").type(NodeType.MENU).build();
        FlowNode bare = FlowNode.builder().id("a").type(NodeType.ACTION).build();
        FlowNode buttons =
                FlowNode.builder()
                        .id("b")
                        .type(NodeType.ACTION)
                        .action(new ButtonsPayload(List.of(), 3, null))
                        .build();
        FlowNode ask =
                FlowNode.builder()
                        .id("q")
                        .type(NodeType.ACTION)
                        .action(new AskPayload(null, null, null, null, null, null, null))
                        .build();
        FlowNode opaque =
                FlowNode.builder()
                        .id("c")
                        .type(NodeType.ACTION)
                        .action(new OpaquePayload("condition", Map.of()))
                        .build();

        assertThat(menu.getKind()).isEqualTo(NodeKind.MENU);
        assertThat(bare.getKind()).isEqualTo(NodeKind.MESSAGE);
        assertThat(buttons.getKind()).isEqualTo(NodeKind.BUTTONS);
        assertThat(ask.getKind()).isEqualTo(NodeKind.ASK);
        assertThat(opaque.getKind()).isEqualTo(NodeKind.OPAQUE);
    }

    @Test
    void shouldCompareByValue() {
        FlowNode a = FlowNode.builder().id("n").label("x").type(NodeType.MENU).build();
        FlowNode b = a.toBuilder().build();

        assertThat(b).isEqualTo(a).hasSameHashCodeAs(a).isNotSameAs(a);
        assertThat(a.toBuilder().label("y").build()).isNotEqualTo(a);
    }
}
