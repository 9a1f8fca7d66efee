package com.phillippitts.voicenav.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous publish/subscribe channel for engine events.
 *
 * <p>Listeners run on the publishing thread, in subscription order. A listener that throws
 * is logged and skipped; it neither stops the remaining listeners nor reaches the publisher.
 * Subscribing the same listener twice for a type is a no-op.
 *
 * <p>One instance is created per application context and injected where needed.
 */
public class EventBus {

    private static final Logger LOG = LogManager.getLogger(EventBus.class);

    private final Map<EventType, CopyOnWriteArrayList<Consumer<VoiceEvent>>> subscribers =
            new ConcurrentHashMap<>();

    public void subscribe(EventType type, Consumer<VoiceEvent> listener) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        subscribers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).addIfAbsent(listener);
    }

    /** @return true if the listener was subscribed for the type */
    public boolean unsubscribe(EventType type, Consumer<VoiceEvent> listener) {
        List<Consumer<VoiceEvent>> list = subscribers.get(type);
        return list != null && list.remove(listener);
    }

    public void publish(EventType type, Map<String, Object> data) {
        publish(VoiceEvent.of(type, data));
    }

    public void publish(VoiceEvent event) {
        List<Consumer<VoiceEvent>> list = subscribers.get(event.type());
        if (list == null || list.isEmpty()) {
            return;
        }
        for (Consumer<VoiceEvent> listener : list) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOG.error("Event listener failed for {}: {}", event.type(), e.toString(), e);
            }
        }
    }

    public int getSubscriberCount(EventType type) {
        List<Consumer<VoiceEvent>> list = subscribers.get(type);
        return list == null ? 0 : list.size();
    }

    /** Removes every subscription for every type. */
    public void clear() {
        subscribers.clear();
    }
}
