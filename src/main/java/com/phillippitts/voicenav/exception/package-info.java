/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicenav.exception.VoiceNavException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicenav.exception.CommandExecutionException} - A matched
 *       command failed while acting; carries the command name</li>
 *   <li>{@link com.phillippitts.voicenav.exception.TranscriptionException} - The speech
 *       transcriber failed to produce text</li>
 *   <li>{@link com.phillippitts.voicenav.exception.InvalidCommandConfigurationException} -
 *       A configured custom command or hotkey binding is malformed</li>
 * </ul>
 *
 * <p>An utterance that matches no command is not an error, and malformed text never
 * raises from the parser. Exceptions map to HTTP status codes via
 * {@code GlobalExceptionHandler} at the REST boundary.
 *
 * @see com.phillippitts.voicenav.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicenav.exception;
