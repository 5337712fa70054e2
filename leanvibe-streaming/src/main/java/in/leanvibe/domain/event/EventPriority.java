package in.leanvibe.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Event priority. Declaration order is the filtering order:
 * DEBUG < LOW < MEDIUM < HIGH < CRITICAL.
 */
public enum EventPriority {
    DEBUG,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(EventPriority threshold) {
        return ordinal() >= threshold.ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventPriority fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
