package com.phillippitts.voicenav.service.pipeline;

/**
 * What happened to one utterance.
 *
 * @param outcome  how the utterance was handled
 * @param text     the processed text that was dispatched, or null
 * @param literal  text typed into the focused application, or null
 */
public record UtteranceResult(Outcome outcome, String text, String literal) {

    public enum Outcome {
        /** Blank, or nothing left after removing filler words. */
        IGNORED,
        /** A command word such as "delete that". */
        EDIT_ACTION,
        /** A registered command ran. */
        COMMAND,
        /** No command matched and the text was typed as dictation. */
        TYPED,
        /** No command matched (or its checks failed) and nothing was typed. */
        UNMATCHED,
        /** The matched command failed. */
        FAILED
    }

    static UtteranceResult of(Outcome outcome) {
        return new UtteranceResult(outcome, null, null);
    }

    public boolean executed() {
        return outcome == Outcome.COMMAND || outcome == Outcome.EDIT_ACTION;
    }
}
