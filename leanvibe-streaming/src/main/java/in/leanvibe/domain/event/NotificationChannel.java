package in.leanvibe.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse topic categories clients subscribe to.
 * ALL is a subscription wildcard; events themselves never carry it,
 * except batch envelopes mixing several channels.
 */
public enum NotificationChannel {
    FILE_SYSTEM,
    ANALYSIS,
    VIOLATIONS,
    AGENT,
    SYSTEM,
    ALL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationChannel fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
