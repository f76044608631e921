package com.arccatalog.service.integrity;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One detected problem: the offending record, what is wrong and what the repair will do.
 * List-type issues also carry the unresolved ids with the missing/total counts.
 */
public final class IntegrityIssue {
    private final IssueType type;
    private final String entityId;
    private final String description;
    private final List<String> unresolvedIds;
    private final int totalCount;

    private IntegrityIssue(IssueType type, String entityId, String description, List<String> unresolvedIds, int totalCount) {
        this.type = Objects.requireNonNull(type);
        this.entityId = Objects.requireNonNull(entityId);
        this.description = description;
        this.unresolvedIds = List.copyOf(unresolvedIds);
        this.totalCount = totalCount;
    }

    public static IntegrityIssue of(IssueType type, String entityId, String description) {
        return new IntegrityIssue(type, entityId, description, Collections.emptyList(), 0);
    }

    public static IntegrityIssue ofList(IssueType type, String entityId, String description,
                                        List<String> unresolvedIds, int totalCount) {
        return new IntegrityIssue(type, entityId, description, unresolvedIds, totalCount);
    }

    public IssueType getType() { return type; }
    public Severity getSeverity() { return type.getSeverity(); }
    public String getEntityId() { return entityId; }
    public String getDescription() { return description; }
    public List<String> getUnresolvedIds() { return unresolvedIds; }
    public int getMissingCount() { return unresolvedIds.size(); }
    public int getTotalCount() { return totalCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntegrityIssue that = (IntegrityIssue) o;
        return totalCount == that.totalCount &&
                type == that.type &&
                entityId.equals(that.entityId) &&
                Objects.equals(description, that.description) &&
                unresolvedIds.equals(that.unresolvedIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, entityId, unresolvedIds);
    }

    @Override
    public String toString() {
        return "[" + getSeverity() + "] " + type + " " + entityId + ": " + description;
    }
}
