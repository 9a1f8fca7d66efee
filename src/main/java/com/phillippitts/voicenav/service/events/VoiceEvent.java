package com.phillippitts.voicenav.service.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable event published on the {@link EventBus}. Payload values may be null
 * (for example a command that produced no literal output).
 */
public record VoiceEvent(EventType type, Map<String, Object> data, Instant at) {

    public VoiceEvent {
        Objects.requireNonNull(type, "type must not be null");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        at = at == null ? Instant.now() : at;
    }

    public static VoiceEvent of(EventType type, Map<String, Object> data) {
        return new VoiceEvent(type, data, Instant.now());
    }

    /** Payload value as a string, or {@code null} when absent. */
    public String get(String key) {
        Object v = data.get(key);
        return v == null ? null : String.valueOf(v);
    }
}
