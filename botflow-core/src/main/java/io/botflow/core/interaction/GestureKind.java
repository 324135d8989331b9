package io.botflow.core.interaction;

/// Pointer-driven canvas interactions.
public enum GestureKind {
    PAN,
    DRAG_NODE,
    DRAG_CONNECTION
}
