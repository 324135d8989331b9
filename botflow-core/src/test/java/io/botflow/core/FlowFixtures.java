package io.botflow.core;

import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.NodeType;
import io.botflow.core.flow.action.ActionPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.MessagePayload;
import io.botflow.core.kind.NodeKindRegistry;
import java.util.ArrayList;
import java.util.List;

/// Small builders for test flows. Nodes are built raw; tests normalize where needed.
public final class FlowFixtures {

    private FlowFixtures() {}

    public static Flow flow(String rootId, FlowNode... nodes) {
        Flow.Builder builder = Flow.builder().id("flow-test").name("Test flow").rootId(rootId);
        for (FlowNode node : nodes) {
            builder.node(node);
        }
        return builder.build();
    }

    public static FlowNode menu(String id, MenuOption... options) {
        return FlowNode.builder()
                .id(id)
                .label("Menu " + id)
                .type(NodeType.MENU)
                .menuOptions(List.of(options))
                .build();
    }

    public static MenuOption option(String id, String targetId) {
        return new MenuOption(id, "Option " + id, null, targetId);
    }

    public static FlowNode message(String id, String targetId) {
        return action(id, new MessagePayload("Hello from " + id), targetId);
    }

    public static FlowNode action(String id, ActionPayload payload, String targetId) {
        return FlowNode.builder()
                .id(id)
                .label("Node " + id)
                .type(NodeType.ACTION)
                .action(payload)
                .children(targetId == null ? List.of() : List.of(targetId))
                .build();
    }

    /// Buttons node with one item per target (`btn-1`, `btn-2`, ...); null targets allowed.
    public static FlowNode buttons(String id, int maxButtons, String... targets) {
        List<ButtonItem> items = new ArrayList<>();
        for (int i = 0; i < targets.length; i++) {
            int n = i + 1;
            items.add(new ButtonItem("btn-" + n, "Button " + n, "B" + n, targets[i]));
        }
        return FlowNode.builder()
                .id(id)
                .label("Buttons " + id)
                .type(NodeType.ACTION)
                .action(new ButtonsPayload(items, maxButtons, null))
                .build();
    }

    /// Checks the two structural invariants on every node: children equal the derived
    /// targets and every target exists.
    public static boolean isConsistent(NodeKindRegistry registry, Flow flow) {
        for (FlowNode node : flow.getNodes().values()) {
            if (!registry.outgoingTargets(node).equals(node.getChildren())) {
                return false;
            }
            for (String target : registry.getTargetSlots(node).values()) {
                if (target != null && !flow.containsNode(target)) {
                    return false;
                }
            }
        }
        return true;
    }
}
