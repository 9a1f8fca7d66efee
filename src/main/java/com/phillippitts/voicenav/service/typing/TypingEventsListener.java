package com.phillippitts.voicenav.service.typing;

import com.phillippitts.voicenav.service.typing.event.AllTypingFallbacksFailedEvent;
import com.phillippitts.voicenav.service.typing.event.TypingFallbackEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Counts typing tier fallbacks per tier and reason ({@code voicenav.typing.fallback}) and
 * dictation that could not be delivered at all ({@code voicenav.typing.failed}). Never logs
 * the text itself.
 */
@Component
class TypingEventsListener {
    private static final Logger LOG = LogManager.getLogger(TypingEventsListener.class);

    private final MeterRegistry registry;

    TypingEventsListener(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    void onFallback(TypingFallbackEvent e) {
        LOG.warn("Typing tier '{}' skipped: {}", e.tier(), e.reason());
        Counter.builder("voicenav.typing.fallback")
                .description("Typing tiers that were skipped or failed")
                .tag("tier", e.tier())
                .tag("reason", e.reason())
                .register(registry)
                .increment();
    }

    @EventListener
    void onAllFailed(AllTypingFallbacksFailedEvent e) {
        LOG.error("Dictation was not delivered by any typing tier: {}", e.reason());
        registry.counter("voicenav.typing.failed").increment();
    }
}
