package io.botflow.core.flow.action;

/// HTTP header of an outgoing webhook.
public record WebhookHeader(String name, String value) {}
