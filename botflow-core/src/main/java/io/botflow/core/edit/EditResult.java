package io.botflow.core.edit;

import io.botflow.core.flow.Flow;
import java.util.Objects;

/// Outcome of a structural operation that may create a node.
///
/// @param flow resulting flow; the caller's original instance when the operation was
///     rejected
/// @param createdNodeId id of the node the operation created, or null when it created
///     none (including every rejection)
public record EditResult(Flow flow, String createdNodeId) {

    public EditResult {
        Objects.requireNonNull(flow, "flow must not be null");
    }

    static EditResult unchanged(Flow flow) {
        return new EditResult(flow, null);
    }

    static EditResult created(Flow flow, String nodeId) {
        return new EditResult(flow, nodeId);
    }

    public boolean isCreated() {
        return createdNodeId != null;
    }
}
