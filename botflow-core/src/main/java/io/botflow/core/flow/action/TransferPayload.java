package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// Moves the conversation to another channel or bot.
public record TransferPayload(String target, String destination) implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.TRANSFER;
    }
}
