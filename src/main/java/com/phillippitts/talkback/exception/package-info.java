/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.talkback.exception.TalkBackException} - Base exception for all
 *       application-specific errors</li>
 *   <li>{@link com.phillippitts.talkback.exception.ConfigurationException} - Missing or invalid
 *       configuration; aborts startup or session creation</li>
 *   <li>{@link com.phillippitts.talkback.exception.BotNotFoundException} - Requested bot
 *       personality file does not exist</li>
 *   <li>{@link com.phillippitts.talkback.exception.TranscriptionException} - Utterance produced
 *       no usable transcript (empty, engine failure, or cancelled)</li>
 *   <li>{@link com.phillippitts.talkback.exception.GenerationException} - Language model failed
 *       to stream a completion</li>
 *   <li>{@link com.phillippitts.talkback.exception.SynthesisException} - Text-to-speech engine
 *       failed for a phrase</li>
 *   <li>{@link com.phillippitts.talkback.exception.TransportException} - Outbound delivery to the
 *       client failed; fatal to the session</li>
 * </ul>
 *
 * <p>Engine exceptions are absorbed by the owning pipeline stage and reported upstream as
 * {@code StageError} frames. Configuration exceptions map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.talkback.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.talkback.exception;
