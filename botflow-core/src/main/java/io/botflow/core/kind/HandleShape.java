package io.botflow.core.kind;

/// Output port layout shared by a group of node kinds.
public enum HandleShape {
    /// One handle per menu option.
    OPTIONS,
    /// One handle per visible button, plus `more` when items overflow.
    BUTTONS,
    /// `answer` and `invalid`.
    ASK,
    /// `in` and `out` of business hours.
    SCHEDULER,
    /// The single `default` handle, whose target is the node's first child.
    SINGLE
}
