/**
 * WebSocket transport: maps socket callbacks onto pipeline transport events and writes
 * pipeline output back to the client.
 */
package com.phillippitts.talkback.presentation.websocket;
