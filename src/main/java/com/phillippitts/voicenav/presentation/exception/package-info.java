/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.voicenav.exception.CommandExecutionException} → 422 Unprocessable Entity</li>
 *   <li>{@link com.phillippitts.voicenav.exception.TranscriptionException} → 503 Service Unavailable</li>
 *   <li>{@code IllegalArgumentException}, invalid request bodies → 400 Bad Request</li>
 *   <li>other {@link com.phillippitts.voicenav.exception.VoiceNavException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "CommandExecutionException",
 *   "message": "Command failed",
 *   "details": "ClickNumberCommand: element 42 not found",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.voicenav.presentation.exception;
