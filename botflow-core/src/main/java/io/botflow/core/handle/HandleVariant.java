package io.botflow.core.handle;

/// Display variant of an output handle.
public enum HandleVariant {
    DEFAULT,
    MORE,
    ANSWER,
    INVALID
}
