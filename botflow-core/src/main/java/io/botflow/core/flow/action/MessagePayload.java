package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// Plain text message sent to the user.
public record MessagePayload(String text) implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.MESSAGE;
    }
}
