/**
 * Audio plumbing: PCM format constants, conversion, WAV wrapping, energy-based voice activity
 * detection, and the utterance buffer that turns a continuous stream into discrete utterances.
 */
package com.phillippitts.talkback.service.audio;
