package com.phillippitts.voicenav.service.typing;

import com.phillippitts.voicenav.service.typing.event.AllTypingFallbacksFailedEvent;
import com.phillippitts.voicenav.service.typing.event.TypingFallbackEvent;
import com.phillippitts.voicenav.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyChainTypingServiceTest {

    @Test
    void fallsBackToNextAdapterAndPublishesFallback() {
        EventCapturingPublisher events = new EventCapturingPublisher();
        StubAdapter robot = new StubAdapter("robot", true, false);
        StubAdapter clipboard = new StubAdapter("clipboard", true, true);
        StrategyChainTypingService svc = new StrategyChainTypingService(List.of(robot, clipboard), events);

        assertThat(svc.type("hello")).isTrue();

        assertThat(clipboard.typed).containsExactly("hello");
        assertThat(events.eventsOf(TypingFallbackEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.tier()).isEqualTo("robot"));
    }

    @Test
    void unavailableAdaptersAreSkippedSilently() {
        EventCapturingPublisher events = new EventCapturingPublisher();
        StubAdapter robot = new StubAdapter("robot", false, true);
        StubAdapter clipboard = new StubAdapter("clipboard", true, true);

        assertThat(new StrategyChainTypingService(List.of(robot, clipboard), events).type("x")).isTrue();

        assertThat(robot.typed).isEmpty();
        assertThat(events.events).isEmpty();
    }

    @Test
    void throwingAdapterIsReportedByExceptionType() {
        EventCapturingPublisher events = new EventCapturingPublisher();
        TypingAdapter broken = new StubAdapter("robot", true, true) {
            @Override
            public boolean type(String text) {
                throw new IllegalStateException("no display");
            }
        };
        StubAdapter notify = new StubAdapter("notify", true, true);

        assertThat(new StrategyChainTypingService(List.of(broken, notify), events).type("x")).isTrue();

        assertThat(events.eventsOf(TypingFallbackEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.reason()).isEqualTo("IllegalStateException"));
    }

    @Test
    void allFailingPublishesAllFailed() {
        EventCapturingPublisher events = new EventCapturingPublisher();
        StrategyChainTypingService svc = new StrategyChainTypingService(
                List.of(new StubAdapter("robot", true, false), new StubAdapter("clipboard", true, false)), events);

        assertThat(svc.type("x")).isFalse();

        assertThat(events.eventsOf(TypingFallbackEvent.class)).hasSize(2);
        assertThat(events.eventsOf(AllTypingFallbacksFailedEvent.class)).hasSize(1);
    }

    static class StubAdapter implements TypingAdapter {
        private final String name;
        private final boolean available;
        private final boolean succeeds;
        final List<String> typed = new ArrayList<>();

        StubAdapter(String name, boolean available, boolean succeeds) {
            this.name = name;
            this.available = available;
            this.succeeds = succeeds;
        }

        @Override public boolean canType() { return available; }

        @Override
        public boolean type(String text) {
            typed.add(text);
            return succeeds;
        }

        @Override public String name() { return name; }
    }
}
