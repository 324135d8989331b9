package io.botflow.core.normalize;

import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.NodeType;
import io.botflow.core.flow.action.ActionPayload;
import io.botflow.core.flow.action.MessagePayload;
import io.botflow.core.kind.NodeKindRegistry;
import io.botflow.core.kind.PayloadDefaults;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Idempotent repair pass over a whole flow.
///
/// For every node, in map order:
/// 1. menu nodes drop any action payload and get complete options (at least one, unique
///    ids); action nodes drop menu options and get a complete payload (a node without
///    payload becomes an empty message);
/// 2. targets that point at no existing node are unbound;
/// 3. `children` is recomputed from the target slots.
///
/// ### Identity
/// A node that needed no repair is returned as the same instance, and a flow whose nodes
/// all came back unchanged is returned as the same instance. Callers detect "nothing to
/// do" with `==`.
///
/// The normalizer never throws on malformed content; it repairs.
///
/// @implNote Stateless and thread-safe.
///
/// @see NodeKindRegistry#outgoingTargets(FlowNode) for the children derivation
public class FlowNormalizer {

    private static final Logger logger = Logger.getLogger(FlowNormalizer.class.getName());

    private final NodeKindRegistry registry;
    private final PayloadDefaults defaults;

    public FlowNormalizer(NodeKindRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.defaults = registry.getDefaults();
    }

    /// Normalizes a flow.
    ///
    /// @param flow flow to repair, not null
    /// @return canonical flow, the same instance when nothing needed repair
    public Flow normalize(Flow flow) {
        Set<String> knownIds = flow.getNodes().keySet();
        Map<String, FlowNode> nodes = new LinkedHashMap<>();
        boolean changed = false;
        for (FlowNode node : flow.getNodes().values()) {
            FlowNode normalized = normalizeNode(node, knownIds);
            if (normalized != node) {
                changed = true;
            }
            nodes.put(normalized.getId(), normalized);
        }
        if (!changed) {
            return flow;
        }
        return flow.toBuilder().nodes(nodes).build();
    }

    /// Normalizes one node against a set of existing node ids.
    ///
    /// @param node node to repair, not null
    /// @param knownIds ids a target may point at, not null
    /// @return canonical node, the same instance when nothing needed repair
    public FlowNode normalizeNode(FlowNode node, Set<String> knownIds) {
        FlowNode shaped = completeContent(node);
        FlowNode attached = shaped;
        if (hasDanglingTarget(shaped, knownIds)) {
            logger.warning("Cleared dangling targets on node " + node.getId());
            attached =
                    registry.retarget(shaped, target -> knownIds.contains(target) ? target : null);
        }
        FlowNode result = registry.withDerivedChildren(attached);
        return result.equals(node) ? node : result;
    }

    private boolean hasDanglingTarget(FlowNode node, Set<String> knownIds) {
        for (String target : registry.getTargetSlots(node).values()) {
            if (target != null && !knownIds.contains(target)) {
                return true;
            }
        }
        return false;
    }

    private FlowNode completeContent(FlowNode node) {
        FlowNode.Builder builder = node.toBuilder();
        if (node.getType() == NodeType.MENU) {
            builder.action(null).menuOptions(defaults.completeOptions(node.getMenuOptions()));
        } else {
            ActionPayload action =
                    node.getAction() != null ? node.getAction() : new MessagePayload("");
            builder.menuOptions(List.of()).action(defaults.complete(action));
        }
        FlowNode completed = builder.build();
        return completed.equals(node) ? node : completed;
    }
}
