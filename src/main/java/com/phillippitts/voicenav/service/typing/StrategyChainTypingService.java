package com.phillippitts.voicenav.service.typing;

import com.phillippitts.voicenav.config.properties.TypingProperties;
import com.phillippitts.voicenav.service.input.ClipboardAccess;
import com.phillippitts.voicenav.service.input.KeyboardActions;
import com.phillippitts.voicenav.service.input.MouseActions;
import com.phillippitts.voicenav.service.typing.event.AllTypingFallbacksFailedEvent;
import com.phillippitts.voicenav.service.typing.event.TypingFallbackEvent;
import com.phillippitts.voicenav.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Tries adapters in order until one succeeds: keystroke paste, clipboard, notify-only.
 */
public class StrategyChainTypingService implements TypingService {
    private static final Logger LOG = LogManager.getLogger(StrategyChainTypingService.class);

    private final List<TypingAdapter> chain;
    private final ApplicationEventPublisher publisher;

    public StrategyChainTypingService(TypingProperties props,
                                      ClipboardAccess clipboard,
                                      KeyboardActions keyboard,
                                      MouseActions timing,
                                      BooleanSupplier inputAvailable,
                                      ApplicationEventPublisher publisher) {
        this(List.of(new KeystrokePasteAdapter(props, clipboard, keyboard, timing, inputAvailable),
                        new ClipboardTypingAdapter(props, clipboard, keyboard),
                        new NotifyOnlyAdapter()),
                publisher);
    }

    // Package-private for tests
    StrategyChainTypingService(List<TypingAdapter> chain, ApplicationEventPublisher publisher) {
        this.chain = List.copyOf(chain);
        this.publisher = Objects.requireNonNull(publisher);
    }

    @Override
    public boolean type(String text) {
        for (TypingAdapter a : chain) {
            if (!a.canType()) {
                LOG.debug("Skipping adapter {}: unavailable", a.name());
                continue;
            }
            try {
                if (a.type(text)) {
                    LOG.info("Typed via {} (chars={})", a.name(), text == null ? 0 : text.length());
                    return true;
                }
                publisher.publishEvent(new TypingFallbackEvent(a.name(), "type returned false", Instant.now()));
            } catch (RuntimeException e) {
                LOG.warn("Adapter {} failed: {}", a.name(), e.toString());
                publisher.publishEvent(new TypingFallbackEvent(a.name(), e.getClass().getSimpleName(), Instant.now()));
            }
        }
        LOG.info("No typing adapters succeeded (chars={}, preview='{}')",
                text == null ? 0 : text.length(), LogSanitizer.truncate(text, 40));
        publisher.publishEvent(new AllTypingFallbacksFailedEvent("no adapters succeeded", Instant.now()));
        return false;
    }
}
