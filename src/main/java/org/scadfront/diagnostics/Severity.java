package org.scadfront.diagnostics;

/**
 * Diagnostic severity, ordered from least to most severe.
 */
public enum Severity {
    DEBUG(0),
    INFO(1),
    WARNING(2),
    ERROR(3),
    FATAL(4);

    private final int level;

    Severity(int level) {
        this.level = level;
    }

    /**
     * @return The numeric level; higher is more severe.
     */
    public int level() {
        return level;
    }

    /**
     * @param threshold The minimum severity.
     * @return True if this severity is at or above the threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return level >= threshold.level;
    }
}
