/**
 * Presentation layer: the WebSocket voice endpoint and the REST API.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - voice transport at {@code /ws/pipeline}</li>
 *   <li>{@code presentation.controller} - REST controllers</li>
 *   <li>{@code presentation.exception} - exception to HTTP status mapping</li>
 * </ul>
 *
 * <p>Presentation depends on service, never the other way round.
 */
package com.phillippitts.talkback.presentation;
