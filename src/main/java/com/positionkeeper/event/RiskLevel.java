package com.positionkeeper.event;

/**
 * Severity level for a {@link RiskEvent}.
 */
public enum RiskLevel {

    /** Informational, e.g. a mode change. */
    INFO,

    /** A proposal was blocked or a limit breached. */
    WARNING,

    /** Automatic protective action: dispatch suspended or a position frozen. */
    CRITICAL
}
