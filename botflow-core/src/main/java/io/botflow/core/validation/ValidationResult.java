package io.botflow.core.validation;

import java.util.List;

/// Outcome of {@link FlowValidator#validate(io.botflow.core.flow.Flow)}.
///
/// @param issues every issue in discovery order
public record ValidationResult(List<ValidationIssue> issues) {

    public ValidationResult {
        issues = List.copyOf(issues);
    }

    /// Returns true when no issue is an error.
    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(issue -> issue.level() == ValidationLevel.WARNING).toList();
    }

    public boolean hasCode(String code) {
        return issues.stream().anyMatch(issue -> issue.code().equals(code));
    }
}
