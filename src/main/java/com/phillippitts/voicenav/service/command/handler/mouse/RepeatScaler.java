package com.phillippitts.voicenav.service.command.handler.mouse;

/**
 * Tracks consecutive invocations in the same direction and returns the doubling multiplier
 * for the next step. A change of direction resets the run.
 */
final class RepeatScaler {

    private final int maxMultiplier;
    private String lastDirection;
    private int repeatCount;

    RepeatScaler(int maxMultiplier) {
        this.maxMultiplier = maxMultiplier;
    }

    synchronized int next(String direction) {
        if (direction.equals(lastDirection)) {
            repeatCount++;
        } else {
            repeatCount = 0;
            lastDirection = direction;
        }
        // shift is bounded so the multiplier cannot overflow on long runs
        int multiplier = 1 << Math.min(repeatCount, 30);
        return Math.min(multiplier, maxMultiplier);
    }

    synchronized void reset() {
        lastDirection = null;
        repeatCount = 0;
    }
}
