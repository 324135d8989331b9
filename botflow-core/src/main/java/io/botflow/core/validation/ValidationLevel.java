package io.botflow.core.validation;

/// Severity of a validation issue. Only {@link #ERROR} blocks publishing.
public enum ValidationLevel {
    ERROR,
    WARNING,
    INFO
}
