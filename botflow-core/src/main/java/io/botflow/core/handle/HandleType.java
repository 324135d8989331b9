package io.botflow.core.handle;

/// Structural category of a handle id.
public enum HandleType {
    /// `out:default`, the single output of message-like kinds.
    DEFAULT,
    /// `out:menu:<optionId>`.
    MENU_OPTION,
    /// `out:button:<itemId>`.
    BUTTON,
    /// `out:button:more`, the overflow list of a buttons node.
    BUTTON_MORE,
    /// `out:answer`.
    ANSWER,
    /// `out:invalid`.
    INVALID,
    /// `out:schedule:in`.
    SCHEDULE_IN,
    /// `out:schedule:out`.
    SCHEDULE_OUT,
    /// `in`, the single input of every node.
    INPUT
}
