/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>The REST boundary drives the engine without a microphone. Presentation depends on
 * service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 */
package com.phillippitts.voicenav.presentation;
