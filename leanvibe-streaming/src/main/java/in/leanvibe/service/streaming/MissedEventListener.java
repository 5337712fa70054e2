package in.leanvibe.service.streaming;

import in.leanvibe.domain.event.StreamEvent;

/**
 * Notified when an event matching an inactive client's preferences could not be delivered.
 */
@FunctionalInterface
public interface MissedEventListener {
    void onMissedEvent(String clientId, StreamEvent event);

    /**
     * The engine marked an active client inactive, either on request or because
     * its transport was found closed during a send.
     */
    default void onClientDeactivated(String clientId) {
        // no-op unless the listener tracks connection state
    }
}
