package io.botflow.core.validation;

/// One problem found in a flow.
///
/// @param level severity
/// @param nodeId node the issue belongs to, or null for flow-level issues
/// @param code stable machine-readable code, e.g. `EMPTY_MESSAGE`
/// @param message human-readable description
/// @param fix suggested remedy, may be null
public record ValidationIssue(
        ValidationLevel level, String nodeId, String code, String message, String fix) {

    public boolean isError() {
        return level == ValidationLevel.ERROR;
    }
}
