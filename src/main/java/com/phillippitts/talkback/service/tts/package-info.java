/**
 * Text-to-speech: the streaming engine contract, the Kokoro HTTP implementation, phrase
 * batching, and the synthesis pipeline stage.
 */
package com.phillippitts.talkback.service.tts;
