package io.botflow.core.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Persisted/exported snapshot: the flow plus canvas positions keyed by node id.
///
/// @param flow the flow graph, not null
/// @param positions node positions, never null (may be empty)
public record FlowDocument(Flow flow, Map<String, NodePosition> positions) {

    public FlowDocument {
        Objects.requireNonNull(flow, "flow must not be null");
        positions =
                positions == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(positions));
    }

    /// Creates a document with no stored positions.
    public static FlowDocument of(Flow flow) {
        return new FlowDocument(flow, Map.of());
    }

    /// Replaces the flow, dropping positions of nodes the new flow no longer contains.
    ///
    /// @param next the new flow, not null
    /// @return this instance when nothing changed, otherwise a new document
    public FlowDocument withFlow(Flow next) {
        Map<String, NodePosition> kept = new LinkedHashMap<>();
        positions.forEach(
                (nodeId, position) -> {
                    if (next.containsNode(nodeId)) {
                        kept.put(nodeId, position);
                    }
                });
        if (next == flow && kept.size() == positions.size()) {
            return this;
        }
        return new FlowDocument(next, kept);
    }
}
