package com.arccatalog.service.integrity;

/**
 * Kinds of reference corruption the validator reports, with their severity.
 */
public enum IssueType {
    MISSING_FILE(Severity.ERROR),
    ORPHANED_TAG(Severity.WARNING),
    ORPHANED_TAG_CATEGORY(Severity.WARNING),
    ORPHANED_COLLECTION(Severity.WARNING),
    ORPHANED_CATEGORY(Severity.WARNING),
    MOODBOARD_MISMATCH(Severity.WARNING),
    STALE_TAG_COUNT(Severity.WARNING),
    MOODBOARD_FLAG_MISMATCH(Severity.WARNING);

    private final Severity severity;

    IssueType(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * Missing media files are reported only; the catalog cannot recreate them.
     */
    public boolean isAutoRepairable() {
        return this != MISSING_FILE;
    }
}
