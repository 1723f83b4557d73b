/**
 * Domain model of a voice conversation.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.talkback.domain.Frame} - closed set of typed units moving
 *       between pipeline stages (audio, transcripts, text deltas, control signals)</li>
 *   <li>{@link com.phillippitts.talkback.domain.Utterance} - audio accumulated for one span of
 *       user speech, with an OPEN, FLUSHING, CLOSED lifecycle</li>
 *   <li>{@link com.phillippitts.talkback.domain.ConversationContext} - ordered dialogue history
 *       sent to the language model on every turn</li>
 *   <li>{@link com.phillippitts.talkback.domain.TranscriptionResult} - text returned by a
 *       speech-to-text engine with its metadata</li>
 * </ul>
 *
 * <p>Frames and results are immutable records validated in their constructors. Utterance and
 * ConversationContext are mutable and owned by exactly one component at a time.
 *
 * @since 1.0
 */
package com.phillippitts.talkback.domain;
