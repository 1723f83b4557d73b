package com.phillippitts.talkback.service.pipeline;

import com.phillippitts.talkback.domain.ConversationContext;
import com.phillippitts.talkback.service.audio.EnergyVadAnalyzer;
import com.phillippitts.talkback.service.audio.UtteranceBuffer;
import com.phillippitts.talkback.service.bus.FrameProcessor;
import com.phillippitts.talkback.service.engine.CancellationToken;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one client connection owns. Nothing here is shared with other sessions.
 *
 * @param id        session identifier, also the logging correlation id
 * @param stages    pipeline stages, head to tail
 * @param buffer    inbound utterance buffer
 * @param context   conversation history, written only by the generation stage
 * @param token     cancellation token shared by the stages
 * @param transport outbound side of the connection
 * @param vad       server-side voice activity detection, when enabled
 */
public record Session(
        String id,
        List<FrameProcessor> stages,
        UtteranceBuffer buffer,
        ConversationContext context,
        CancellationToken token,
        TransportSink transport,
        Optional<EnergyVadAnalyzer> vad
) {
    public Session {
        Objects.requireNonNull(id, "id must not be null");
        stages = List.copyOf(stages);
        Objects.requireNonNull(buffer, "buffer must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(transport, "transport must not be null");
        vad = vad == null ? Optional.empty() : vad;
    }
}
