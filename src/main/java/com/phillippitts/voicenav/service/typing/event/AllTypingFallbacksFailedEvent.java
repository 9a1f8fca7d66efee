package com.phillippitts.voicenav.service.typing.event;

import java.time.Instant;

/** Published when no typing adapter delivered the text. */
public record AllTypingFallbacksFailedEvent(String reason, Instant at) { }
