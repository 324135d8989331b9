package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// Ends the conversation.
public record EndPayload() implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.END;
    }
}
