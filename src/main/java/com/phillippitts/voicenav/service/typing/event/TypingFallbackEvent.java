package com.phillippitts.voicenav.service.typing.event;

import java.time.Instant;

/** Published when a typing adapter fails and the next tier is attempted. */
public record TypingFallbackEvent(String tier, String reason, Instant at) { }
