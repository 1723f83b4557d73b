/**
 * Speech-to-text: the engine contract, the Whisper HTTP implementation, and the transcription
 * pipeline stage.
 */
package com.phillippitts.talkback.service.stt;
