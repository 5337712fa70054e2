package in.leanvibe.domain.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Event types emitted by LeanVibe producers.
 * Wire names are the lowercase enum names (e.g. FILE_CHANGED -> "file_changed").
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // FILE SYSTEM
    // ═══════════════════════════════════════════════════════════════
    FILE_CHANGED,
    FILE_CREATED,
    FILE_DELETED,
    FILE_MOVED,

    // ═══════════════════════════════════════════════════════════════
    // ANALYSIS
    // ═══════════════════════════════════════════════════════════════
    AST_ANALYSIS_STARTED,
    AST_ANALYSIS_COMPLETED,
    AST_ANALYSIS_FAILED,

    // ═══════════════════════════════════════════════════════════════
    // VIOLATIONS
    // ═══════════════════════════════════════════════════════════════
    VIOLATION_DETECTED,
    VIOLATION_RESOLVED,

    // ═══════════════════════════════════════════════════════════════
    // AGENT
    // ═══════════════════════════════════════════════════════════════
    AGENT_STARTED,
    AGENT_PROCESSING,
    AGENT_COMPLETED,
    AGENT_ERROR,

    // ═══════════════════════════════════════════════════════════════
    // SYSTEM
    // ═══════════════════════════════════════════════════════════════
    SYSTEM_READY,
    SYSTEM_ERROR,
    SYSTEM_DEGRADED,
    SYSTEM_RECOVERED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAgentEvent() {
        return this == AGENT_STARTED || this == AGENT_PROCESSING
            || this == AGENT_COMPLETED || this == AGENT_ERROR;
    }

    public boolean isSystemEvent() {
        return this == SYSTEM_READY || this == SYSTEM_ERROR
            || this == SYSTEM_DEGRADED || this == SYSTEM_RECOVERED;
    }
}
