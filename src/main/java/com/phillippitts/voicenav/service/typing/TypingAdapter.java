package com.phillippitts.voicenav.service.typing;

/**
 * One tier of the typing chain. {@link StrategyChainTypingService} tries tiers in order and
 * stops at the first that reports success.
 */
interface TypingAdapter {

    /** False when this tier cannot work here (no Robot, disabled by configuration). */
    boolean canType();

    boolean type(String text);

    /** Tier name used in fallback events and metrics tags. */
    String name();
}
