package org.lakeshift.schema;

import java.util.List;

public record ValidationResult(List<ValidationIssue> issues) {
    public ValidationResult {
        issues = List.copyOf(issues);
    }

    public boolean ok() {
        return issues.isEmpty();
    }
}
