/**
 * REST API controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/utterances} - handle one recognized utterance {@code {"text": "..."}}</li>
 *   <li>{@code POST /api/audio} - transcribe raw PCM audio, then handle it as an utterance</li>
 *   <li>{@code GET /api/commands} - help listing of the registered commands</li>
 *   <li>{@code GET /ping} - liveness and MDC log check</li>
 * </ul>
 *
 * @see com.phillippitts.voicenav.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicenav.presentation.controller;
