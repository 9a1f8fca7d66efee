package com.phillippitts.voicenav.service.pipeline;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.exception.TranscriptionException;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandRegistry;
import com.phillippitts.voicenav.service.command.ProcessResult;
import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.events.EventType;
import com.phillippitts.voicenav.service.input.KeyboardActions;
import com.phillippitts.voicenav.service.parser.CommandParser;
import com.phillippitts.voicenav.service.text.CommandAction;
import com.phillippitts.voicenav.service.text.ProcessedText;
import com.phillippitts.voicenav.service.text.TextProcessor;
import com.phillippitts.voicenav.service.typing.TypingService;
import com.phillippitts.voicenav.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.awt.event.KeyEvent;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one recognized utterance end to end: text clean-up, command words, command dispatch and
 * typing of literal text.
 *
 * <p>Callers serialize utterances (a single-threaded executor in production); this class does
 * no locking of its own. Each utterance runs with an {@code utterance} id in the log4j
 * {@link ThreadContext}.
 */
public class UtteranceProcessor {

    private static final Logger LOG = LogManager.getLogger(UtteranceProcessor.class);

    static final String MDC_UTTERANCE = "utterance";

    private final TextProcessor textProcessor;
    private final CommandParser parser;
    private final CommandRegistry registry;
    private final CommandContext context;
    private final TypingService typing;
    private final EventBus eventBus;
    private final boolean commandOnlyMode;
    private final SpeechTranscriber transcriber;

    public UtteranceProcessor(TextProcessor textProcessor,
                              CommandParser parser,
                              CommandRegistry registry,
                              CommandContext context,
                              TypingService typing,
                              EventBus eventBus,
                              boolean commandOnlyMode,
                              SpeechTranscriber transcriber) {
        this.textProcessor = Objects.requireNonNull(textProcessor, "textProcessor must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.typing = Objects.requireNonNull(typing, "typing must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.commandOnlyMode = commandOnlyMode;
        this.transcriber = transcriber; // optional
    }

    public boolean isCommandOnlyMode() {
        return commandOnlyMode;
    }

    public boolean hasTranscriber() {
        return transcriber != null;
    }

    /**
     * Handles one utterance. A failing command is logged and reported as
     * {@link EventType#ERROR_OCCURRED}; it never propagates to the caller.
     */
    public UtteranceResult process(String text) {
        if (text == null || text.isBlank()) {
            return UtteranceResult.of(UtteranceResult.Outcome.IGNORED);
        }
        ThreadContext.put(MDC_UTTERANCE, UUID.randomUUID().toString().substring(0, 8));
        try {
            return handle(text);
        } finally {
            ThreadContext.remove(MDC_UTTERANCE);
        }
    }

    /**
     * Transcribes audio and handles the recognized text.
     *
     * @throws TranscriptionException if no transcriber is configured or recognition failed
     */
    public UtteranceResult processAudio(byte[] pcm) {
        if (transcriber == null) {
            throw new TranscriptionException("No speech transcriber configured");
        }
        String text;
        try {
            text = transcriber.transcribe(pcm);
        } catch (TranscriptionException e) {
            publish(EventType.TRANSCRIPTION_FAILED, "transcriber", transcriber.name(), "error", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            publish(EventType.TRANSCRIPTION_FAILED, "transcriber", transcriber.name(), "error", e.toString());
            throw new TranscriptionException("Transcription failed: " + e.getMessage(), transcriber.name(), e);
        }
        publish(EventType.TRANSCRIPTION_COMPLETED, "transcriber", transcriber.name(), "text", text);
        return process(text);
    }

    private UtteranceResult handle(String text) {
        LOG.info("Heard '{}'", LogSanitizer.truncate(text, 60));
        ProcessedText processed;
        try {
            processed = textProcessor.process(text);
        } catch (RuntimeException e) {
            LOG.error("Text processing failed", e);
            publish(EventType.ERROR_OCCURRED, "component", "text_processing", "error", e.toString());
            return new UtteranceResult(UtteranceResult.Outcome.FAILED, text, null);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("original", text);
        data.put("processed", processed.text());
        data.put("command_action", processed.commandAction().map(a -> a.name().toLowerCase(Locale.ROOT)).orElse(null));
        eventBus.publish(EventType.TEXT_PROCESSED, data);

        if (processed.isCommand()) {
            runAction(processed.action());
            return new UtteranceResult(UtteranceResult.Outcome.EDIT_ACTION, text, null);
        }

        String cleaned = processed.textValue().orElse("");
        String dispatchText = parser.filterIgnoredWords(cleaned);
        if (dispatchText.isBlank()) {
            LOG.debug("Nothing left after filtering filler words");
            return UtteranceResult.of(UtteranceResult.Outcome.IGNORED);
        }

        ProcessResult result;
        try {
            result = registry.process(dispatchText, context);
        } catch (CommandExecutionException e) {
            LOG.warn("Command {} failed: {}", e.getCommandName(), e.getReason());
            publish(EventType.ERROR_OCCURRED, "component", "command", "error", e.getMessage());
            return new UtteranceResult(UtteranceResult.Outcome.FAILED, dispatchText, null);
        }

        if (result.executed()) {
            Optional<String> literal = result.literalText();
            literal.ifPresent(this::type);
            return new UtteranceResult(UtteranceResult.Outcome.COMMAND, dispatchText, literal.orElse(null));
        }
        if (!commandOnlyMode) {
            type(cleaned);
            return new UtteranceResult(UtteranceResult.Outcome.TYPED, dispatchText, cleaned);
        }
        LOG.info("No command for '{}' (command-only mode)", LogSanitizer.truncate(dispatchText, 60));
        return new UtteranceResult(UtteranceResult.Outcome.UNMATCHED, dispatchText, null);
    }

    private void runAction(CommandAction action) {
        KeyboardActions kb = context.getKeyboard();
        switch (action) {
            case UNDO_LAST -> {
                int n = textProcessor.getLastTextLength();
                for (int i = 0; i < n; i++) {
                    kb.tap(KeyEvent.VK_BACK_SPACE);
                }
                textProcessor.rememberTyped("");
                LOG.info("Undo last: deleted {} characters", n);
            }
            case CLEAR_LINE -> {
                kb.tap(KeyEvent.VK_HOME);
                kb.combination(KeyEvent.VK_SHIFT, KeyEvent.VK_END);
                kb.tap(KeyEvent.VK_BACK_SPACE);
                LOG.info("Cleared line");
            }
        }
    }

    private void type(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (typing.type(text)) {
            textProcessor.rememberTyped(text);
            publish(EventType.TEXT_TYPED, "text", text, "length", text.length());
        } else {
            publish(EventType.ERROR_OCCURRED, "component", "typing", "error", "text could not be typed");
        }
    }

    private void publish(EventType type, String k1, Object v1, String k2, Object v2) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(k1, v1);
        data.put(k2, v2);
        eventBus.publish(type, data);
    }
}
