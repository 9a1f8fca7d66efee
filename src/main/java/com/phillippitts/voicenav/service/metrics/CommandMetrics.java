package com.phillippitts.voicenav.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for command dispatch.
 *
 * <p>Exposed at /actuator/metrics:
 * <ul>
 *   <li>voicenav.command.detected - tagged by command</li>
 *   <li>voicenav.command.executed - tagged by command</li>
 *   <li>voicenav.command.failed - tagged by command and reason</li>
 *   <li>voicenav.utterance.typed - dictation typed into the focused application</li>
 * </ul>
 */
public class CommandMetrics {

    private static final String METRIC_PREFIX = "voicenav";

    private final MeterRegistry registry;

    public CommandMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementDetected(String command) {
        Counter.builder(METRIC_PREFIX + ".command.detected")
                .description("Utterances matched to a command")
                .tag("command", command)
                .register(registry)
                .increment();
    }

    public void incrementExecuted(String command) {
        Counter.builder(METRIC_PREFIX + ".command.executed")
                .description("Commands that ran successfully")
                .tag("command", command)
                .register(registry)
                .increment();
    }

    /**
     * @param reason validation_failed, validation_error, execution_error or unexpected_error
     */
    public void incrementFailed(String command, String reason) {
        Counter.builder(METRIC_PREFIX + ".command.failed")
                .description("Commands rejected by validation or failing while running")
                .tag("command", command)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementTyped() {
        Counter.builder(METRIC_PREFIX + ".utterance.typed")
                .description("Utterances typed as dictation")
                .register(registry)
                .increment();
    }
}
