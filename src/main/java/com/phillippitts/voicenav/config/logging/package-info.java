/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - set by {@link com.phillippitts.voicenav.config.logging.MdcFilter}
 *       for every HTTP request and carried onto the utterance executor</li>
 *   <li>{@code utterance} - short id set while one utterance is handled</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [utterance-1] [requestId] [utterance] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.voicenav.config.logging;
