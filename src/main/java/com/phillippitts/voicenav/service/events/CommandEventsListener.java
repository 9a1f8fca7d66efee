package com.phillippitts.voicenav.service.events;

import com.phillippitts.voicenav.service.metrics.CommandMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Bridges the {@link EventBus} to metrics and logs. Repeated failures of the same command for
 * the same reason are logged at most once a minute.
 */
@Component
class CommandEventsListener {
    private static final Logger LOG = LogManager.getLogger(CommandEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final EventBus eventBus;
    private final CommandMetrics metrics;
    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    private final Consumer<VoiceEvent> onDetected = this::onDetected;
    private final Consumer<VoiceEvent> onExecuted = this::onExecuted;
    private final Consumer<VoiceEvent> onFailed = this::onFailed;
    private final Consumer<VoiceEvent> onTyped = this::onTyped;
    private final Consumer<VoiceEvent> onError = this::onError;

    CommandEventsListener(EventBus eventBus, CommandMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @PostConstruct
    void subscribe() {
        eventBus.subscribe(EventType.COMMAND_DETECTED, onDetected);
        eventBus.subscribe(EventType.COMMAND_EXECUTED, onExecuted);
        eventBus.subscribe(EventType.COMMAND_FAILED, onFailed);
        eventBus.subscribe(EventType.TEXT_TYPED, onTyped);
        eventBus.subscribe(EventType.ERROR_OCCURRED, onError);
    }

    @PreDestroy
    void unsubscribe() {
        eventBus.unsubscribe(EventType.COMMAND_DETECTED, onDetected);
        eventBus.unsubscribe(EventType.COMMAND_EXECUTED, onExecuted);
        eventBus.unsubscribe(EventType.COMMAND_FAILED, onFailed);
        eventBus.unsubscribe(EventType.TEXT_TYPED, onTyped);
        eventBus.unsubscribe(EventType.ERROR_OCCURRED, onError);
    }

    void onDetected(VoiceEvent e) {
        metrics.incrementDetected(e.get("command"));
    }

    void onExecuted(VoiceEvent e) {
        metrics.incrementExecuted(e.get("command"));
    }

    void onFailed(VoiceEvent e) {
        String command = e.get("command");
        String reason = e.get("reason");
        metrics.incrementFailed(command, reason);
        if (shouldLog(command + '-' + reason)) {
            LOG.warn("Command {} failed: reason={}, error={}", command, reason, e.get("error"));
        }
    }

    void onTyped(VoiceEvent e) {
        metrics.incrementTyped();
    }

    void onError(VoiceEvent e) {
        if (shouldLog("error-" + e.get("component"))) {
            LOG.warn("Error in {}: {}", e.get("component"), e.get("error"));
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
