package com.phillippitts.talkback.service.llm;

import com.phillippitts.talkback.domain.Message;
import com.phillippitts.talkback.exception.GenerationException;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.EngineStream;
import com.phillippitts.talkback.service.engine.InferenceEngine;

import java.util.List;

/**
 * Contract for streaming chat-completion engines.
 */
public interface LlmEngine extends InferenceEngine {

    /**
     * Opens a streaming completion over the whole conversation.
     *
     * <p>The returned stream yields text increments in generation order. Failures while opening
     * or while streaming surface as {@link GenerationException}.
     *
     * @param messages conversation history, system message first
     * @param token    session cancellation token; firing it ends the stream
     * @return lazy stream of text increments; the caller must close it
     */
    EngineStream<String> streamChat(List<Message> messages, CancellationToken token);
}
