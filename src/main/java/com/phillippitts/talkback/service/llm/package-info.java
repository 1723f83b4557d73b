/**
 * Language-model generation: the streaming engine contract, the Ollama implementation, the
 * per-response stream, and the generation pipeline stage that owns the conversation context.
 */
package com.phillippitts.talkback.service.llm;
