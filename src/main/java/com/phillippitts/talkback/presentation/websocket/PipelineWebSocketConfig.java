package com.phillippitts.talkback.presentation.websocket;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the pipeline endpoint at {@value #PIPELINE_PATH}.
 */
@Configuration
@EnableWebSocket
public class PipelineWebSocketConfig implements WebSocketConfigurer {

    public static final String PIPELINE_PATH = "/ws/pipeline";

    private final PipelineWebSocketHandler handler;

    public PipelineWebSocketConfig(PipelineWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, PIPELINE_PATH)
                .setAllowedOriginPatterns("*");
    }
}
