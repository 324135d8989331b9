package io.botflow.core.flow;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Mutable working copy of a {@link Flow} used while an edit is being assembled.
///
/// Nodes themselves are immutable, so the draft only copies the id-to-node map; untouched
/// nodes are shared with the base flow. A draft that is discarded leaves the base flow
/// untouched, which is how structural operations stay atomic.
///
/// @implNote **Not thread-safe**. A draft is owned by a single operation and must not
/// escape it.
public final class FlowDraft {

    private final Flow base;
    private final Map<String, FlowNode> nodes;
    private boolean modified;

    private FlowDraft(Flow base) {
        this.base = base;
        this.nodes = new LinkedHashMap<>(base.getNodes());
    }

    /// Opens a draft over the given flow.
    ///
    /// @param flow base flow, not null
    /// @return new draft, never null
    public static FlowDraft of(Flow flow) {
        return new FlowDraft(Objects.requireNonNull(flow, "flow must not be null"));
    }

    public Flow getBase() {
        return base;
    }

    public String getRootId() {
        return base.getRootId();
    }

    public FlowNode node(String nodeId) {
        return nodeId == null ? null : nodes.get(nodeId);
    }

    public boolean contains(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /// Returns a read-only view of the draft's current nodes in insertion order.
    public Collection<FlowNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /// Adds or replaces a node.
    ///
    /// @param node the node to store, not null
    public void put(FlowNode node) {
        FlowNode previous = nodes.put(node.getId(), node);
        if (previous != node) {
            modified = true;
        }
    }

    /// Removes a node. References to it are left for the caller to clean up.
    ///
    /// @param nodeId id of the node to remove
    /// @return the removed node, or null if it was absent
    public FlowNode remove(String nodeId) {
        FlowNode removed = nodes.remove(nodeId);
        if (removed != null) {
            modified = true;
        }
        return removed;
    }

    public boolean isModified() {
        return modified;
    }

    /// Materializes the draft.
    ///
    /// @return the base flow itself when nothing was modified, otherwise a new flow
    /// @throws IllegalStateException if the root node was removed
    public Flow commit() {
        if (!modified) {
            return base;
        }
        return base.toBuilder().nodes(nodes).build();
    }
}
