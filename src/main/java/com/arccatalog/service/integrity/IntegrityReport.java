package com.arccatalog.service.integrity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a validation pass. The catalog is valid when no issue has ERROR severity.
 */
public final class IntegrityReport {
    private final List<IntegrityIssue> issues;

    public IntegrityReport(List<IntegrityIssue> issues) {
        this.issues = List.copyOf(issues);
    }

    public boolean isValid() {
        return issues.stream().noneMatch(i -> i.getSeverity() == Severity.ERROR);
    }

    public List<IntegrityIssue> getIssues() {
        return issues;
    }

    public List<IntegrityIssue> getIssues(IssueType type) {
        return issues.stream().filter(i -> i.getType() == type).collect(Collectors.toList());
    }

    public long count(Severity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).count();
    }

    @Override
    public String toString() {
        return "IntegrityReport{valid=" + isValid() +
                ", errors=" + count(Severity.ERROR) +
                ", warnings=" + count(Severity.WARNING) + '}';
    }
}
