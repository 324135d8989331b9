package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// Pauses the conversation until an inbound webhook hits `path`.
public record WebhookInPayload(String path, String secret, String sample)
        implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.WEBHOOK_IN;
    }
}
