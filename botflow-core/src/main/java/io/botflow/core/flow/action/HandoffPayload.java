package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// Hands the conversation over to a human agent queue.
public record HandoffPayload(String queue, String note) implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.HANDOFF;
    }
}
