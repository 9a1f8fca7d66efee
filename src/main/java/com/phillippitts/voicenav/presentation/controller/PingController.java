package com.phillippitts.voicenav.presentation.controller;

import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.pipeline.UtteranceProcessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness check with a short engine summary: interpretation mode, transcriber presence and the
 * visible overlay. Requests pass the MDC filter, so the log line carries the requestId.
 */
@RestController
class PingController {

    private static final Logger LOG = LogManager.getLogger(PingController.class);

    private final UtteranceProcessor processor;
    private final OverlayCoordinator overlays;

    PingController(UtteranceProcessor processor, OverlayCoordinator overlays) {
        this.processor = processor;
        this.overlays = overlays;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        LOG.info("Ping received");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("mode", processor.isCommandOnlyMode() ? "command" : "dictation");
        body.put("transcriber", processor.hasTranscriber());
        body.put("overlay", overlays.getCurrentKind().map(OverlayKind::label).orElse("none"));
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
