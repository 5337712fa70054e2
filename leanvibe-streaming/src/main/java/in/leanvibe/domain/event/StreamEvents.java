package in.leanvibe.domain.event;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Typed constructors for {@link StreamEvent}.
 *
 * Priority and channel are a pure function of the event kind:
 * <ul>
 *   <li>file change: MEDIUM / FILE_SYSTEM</li>
 *   <li>analysis: MEDIUM on success, HIGH on failure / ANALYSIS</li>
 *   <li>violation: HIGH for severity "error", else MEDIUM / VIOLATIONS</li>
 *   <li>agent: MEDIUM, HIGH for AGENT_ERROR / AGENT</li>
 *   <li>system: HIGH for SYSTEM_ERROR and SYSTEM_DEGRADED, else MEDIUM / SYSTEM</li>
 * </ul>
 */
public final class StreamEvents {

    public static final String SOURCE_FILE_MONITOR = "file_monitor";
    public static final String SOURCE_ANALYZER = "ast_analyzer";
    public static final String SOURCE_VIOLATION_DETECTOR = "violation_detector";
    public static final String SOURCE_AGENT = "agent";
    public static final String SOURCE_SYSTEM = "system";

    private StreamEvents() {}

    // ═══════════════════════════════════════════════════════════════
    // FILE SYSTEM
    // ═══════════════════════════════════════════════════════════════

    public static StreamEvent fileChange(String filePath, String changeType) {
        return fileChange(filePath, changeType, null);
    }

    /**
     * File change event. A non-null old path makes it a FILE_MOVED event.
     */
    public static StreamEvent fileChange(String filePath, String changeType, String oldPath) {
        EventType type = fileEventType(changeType, oldPath);
        return build(type, EventPriority.MEDIUM, NotificationChannel.FILE_SYSTEM, SOURCE_FILE_MONITOR,
            new FileChangePayload(filePath, changeType, oldPath));
    }

    private static EventType fileEventType(String changeType, String oldPath) {
        if (oldPath != null) {
            return EventType.FILE_MOVED;
        }
        if (changeType == null) {
            return EventType.FILE_CHANGED;
        }
        return switch (changeType.toLowerCase(Locale.ROOT)) {
            case "created" -> EventType.FILE_CREATED;
            case "deleted" -> EventType.FILE_DELETED;
            case "moved" -> EventType.FILE_MOVED;
            default -> EventType.FILE_CHANGED;
        };
    }

    // ═══════════════════════════════════════════════════════════════
    // ANALYSIS
    // ═══════════════════════════════════════════════════════════════

    public static StreamEvent analysis(String analysisType, String filePath, boolean success,
                                       double processingTimeSeconds) {
        return analysis(analysisType, filePath, success, processingTimeSeconds, null, null);
    }

    public static StreamEvent analysis(String analysisType, String filePath, boolean success,
                                       double processingTimeSeconds, Double confidenceScore,
                                       String errorMessage) {
        EventType type = success ? EventType.AST_ANALYSIS_COMPLETED : EventType.AST_ANALYSIS_FAILED;
        EventPriority priority = success ? EventPriority.MEDIUM : EventPriority.HIGH;
        return build(type, priority, NotificationChannel.ANALYSIS, SOURCE_ANALYZER,
            new AnalysisPayload(analysisType, filePath, success, processingTimeSeconds,
                confidenceScore, errorMessage));
    }

    public static StreamEvent analysisStarted(String analysisType, String filePath) {
        return build(EventType.AST_ANALYSIS_STARTED, EventPriority.LOW, NotificationChannel.ANALYSIS,
            SOURCE_ANALYZER, new AnalysisPayload(analysisType, filePath, true, 0.0, null, null));
    }

    // ═══════════════════════════════════════════════════════════════
    // VIOLATIONS
    // ═══════════════════════════════════════════════════════════════

    public static StreamEvent violation(String violationId, String violationType, String severity,
                                        String filePath, String description) {
        return violation(violationId, violationType, severity, filePath, description, null);
    }

    public static StreamEvent violation(String violationId, String violationType, String severity,
                                        String filePath, String description, Double confidenceScore) {
        EventPriority priority = "error".equalsIgnoreCase(severity) ? EventPriority.HIGH : EventPriority.MEDIUM;
        return build(EventType.VIOLATION_DETECTED, priority, NotificationChannel.VIOLATIONS,
            SOURCE_VIOLATION_DETECTOR,
            new ViolationPayload(violationId, violationType, severity, filePath, description, confidenceScore));
    }

    public static StreamEvent violationResolved(String violationId, String violationType, String filePath) {
        return build(EventType.VIOLATION_RESOLVED, EventPriority.LOW, NotificationChannel.VIOLATIONS,
            SOURCE_VIOLATION_DETECTOR,
            new ViolationPayload(violationId, violationType, null, filePath, null, null));
    }

    // ═══════════════════════════════════════════════════════════════
    // AGENT
    // ═══════════════════════════════════════════════════════════════

    public static StreamEvent agent(String sessionId, EventType type, String query) {
        return agent(sessionId, type, query, null, null);
    }

    public static StreamEvent agent(String sessionId, EventType type, String query, String response,
                                    Double confidenceScore) {
        if (!type.isAgentEvent()) {
            throw new IllegalArgumentException("Not an agent event type: " + type);
        }
        EventPriority priority = type == EventType.AGENT_ERROR ? EventPriority.HIGH : EventPriority.MEDIUM;
        return build(type, priority, NotificationChannel.AGENT, SOURCE_AGENT,
            new AgentPayload(sessionId, query, response, confidenceScore));
    }

    // ═══════════════════════════════════════════════════════════════
    // SYSTEM
    // ═══════════════════════════════════════════════════════════════

    public static StreamEvent system(EventType type, String message, Map<String, Object> details) {
        if (!type.isSystemEvent()) {
            throw new IllegalArgumentException("Not a system event type: " + type);
        }
        EventPriority priority = (type == EventType.SYSTEM_ERROR || type == EventType.SYSTEM_DEGRADED)
            ? EventPriority.HIGH
            : EventPriority.MEDIUM;
        return build(type, priority, NotificationChannel.SYSTEM, SOURCE_SYSTEM, new SystemPayload(message, details));
    }

    private static StreamEvent build(EventType type, EventPriority priority, NotificationChannel channel,
                                     String source, EventPayload payload) {
        return new StreamEvent(UUID.randomUUID().toString(), type, priority, channel, Instant.now(), source, payload);
    }
}
