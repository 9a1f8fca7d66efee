package com.phillippitts.voicenav.presentation.controller;

import com.phillippitts.voicenav.exception.VoiceNavException;
import com.phillippitts.voicenav.service.command.CommandRegistry;
import com.phillippitts.voicenav.service.pipeline.UtteranceProcessor;
import com.phillippitts.voicenav.service.pipeline.UtteranceResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Drives the engine without a microphone. Utterances run on the utterance executor so input
 * injection never happens on a servlet thread and utterances keep their arrival order.
 */
@RestController
@RequestMapping("/api")
class UtteranceController {

    private static final Logger LOG = LogManager.getLogger(UtteranceController.class);

    static final long TIMEOUT_SECONDS = 30;

    private final UtteranceProcessor processor;
    private final CommandRegistry registry;
    private final Executor executor;

    UtteranceController(UtteranceProcessor processor,
                        CommandRegistry registry,
                        @Qualifier("utteranceExecutor") Executor executor) {
        this.processor = processor;
        this.registry = registry;
        this.executor = executor;
    }

    @PostMapping("/utterances")
    ResponseEntity<UtteranceResponse> utterance(@Valid @RequestBody UtteranceRequest request) {
        UtteranceResult result = await(() -> processor.process(request.text()));
        HttpStatus status = result.outcome() == UtteranceResult.Outcome.FAILED
                ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.OK;
        return ResponseEntity.status(status).body(UtteranceResponse.of(result));
    }

    @PostMapping(value = "/audio", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    ResponseEntity<UtteranceResponse> audio(@RequestBody byte[] pcm) {
        if (pcm == null || pcm.length == 0) {
            throw new IllegalArgumentException("audio body must not be empty");
        }
        UtteranceResult result = await(() -> processor.processAudio(pcm));
        return ResponseEntity.ok(UtteranceResponse.of(result));
    }

    @GetMapping(value = "/commands", produces = MediaType.TEXT_PLAIN_VALUE)
    String commands() {
        return registry.getHelpText();
    }

    private UtteranceResult await(Supplier<UtteranceResult> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Utterance failed", e.getCause());
        } catch (TimeoutException e) {
            LOG.warn("Utterance did not finish within {}s", TIMEOUT_SECONDS);
            throw new VoiceNavException("Utterance did not finish within " + TIMEOUT_SECONDS + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for utterance", e);
        }
    }

    record UtteranceRequest(@NotBlank @Size(max = 1000) String text) { }

    record UtteranceResponse(boolean executed, String literal, String outcome) {
        static UtteranceResponse of(UtteranceResult r) {
            return new UtteranceResponse(r.executed(), r.literal(), r.outcome().name());
        }
    }
}
