package com.phillippitts.voicenav.service.typing;

import com.phillippitts.voicenav.service.typing.event.AllTypingFallbacksFailedEvent;
import com.phillippitts.voicenav.service.typing.event.TypingFallbackEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TypingEventsListenerTest {

    @Test
    void countsFallbacksPerTier() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TypingEventsListener listener = new TypingEventsListener(registry);

        listener.onFallback(new TypingFallbackEvent("robot", "unavailable", Instant.now()));
        listener.onFallback(new TypingFallbackEvent("robot", "unavailable", Instant.now()));
        listener.onFallback(new TypingFallbackEvent("clipboard", "failure", Instant.now()));
        listener.onAllFailed(new AllTypingFallbacksFailedEvent("all tiers failed", Instant.now()));

        assertThat(registry.get("voicenav.typing.fallback").tag("tier", "robot").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("voicenav.typing.fallback").tag("tier", "clipboard").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("voicenav.typing.failed").counter().count()).isEqualTo(1.0);
    }
}
