package io.botflow.core.flow;

/// Canvas coordinates of a node, persisted next to the flow but never read by the core.
public record NodePosition(double x, double y) {}
