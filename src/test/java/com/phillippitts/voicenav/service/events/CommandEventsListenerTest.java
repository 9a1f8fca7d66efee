package com.phillippitts.voicenav.service.events;

import com.phillippitts.voicenav.service.metrics.CommandMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CommandEventsListenerTest {

    private EventBus bus;
    private SimpleMeterRegistry registry;
    private CommandEventsListener listener;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        registry = new SimpleMeterRegistry();
        listener = new CommandEventsListener(bus, new CommandMetrics(registry));
        listener.subscribe();
    }

    @Test
    void bridgesBusEventsToCounters() {
        bus.publish(EventType.COMMAND_DETECTED, Map.of("command", "ScrollCommand"));
        bus.publish(EventType.COMMAND_EXECUTED, Map.of("command", "ScrollCommand"));
        bus.publish(EventType.COMMAND_FAILED, Map.of("command", "ClickNumberCommand",
                "reason", "validation_failed"));
        bus.publish(EventType.TEXT_TYPED, Map.of("length", "5"));

        assertThat(registry.get("voicenav.command.detected").tag("command", "ScrollCommand")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("voicenav.command.executed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("voicenav.command.failed").tag("reason", "validation_failed")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("voicenav.utterance.typed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unsubscribeDetachesEveryListener() {
        listener.unsubscribe();

        assertThat(bus.getSubscriberCount(EventType.COMMAND_DETECTED)).isZero();
        assertThat(bus.getSubscriberCount(EventType.ERROR_OCCURRED)).isZero();
        bus.publish(EventType.COMMAND_DETECTED, Map.of("command", "ScrollCommand"));
        assertThat(registry.find("voicenav.command.detected").counter()).isNull();
    }

    @Test
    void throttlesRepeatedFailureLogs() {
        assertThat(listener.shouldLog("ClickNumberCommand-execution_error")).isTrue();
        assertThat(listener.shouldLog("ClickNumberCommand-execution_error")).isFalse();
        assertThat(listener.shouldLog("ClickNumberCommand-validation_failed")).isTrue();
    }
}
