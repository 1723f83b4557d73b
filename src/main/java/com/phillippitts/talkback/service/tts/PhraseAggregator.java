package com.phillippitts.talkback.service.tts;

import java.util.ArrayList;
import java.util.List;

/**
 * Batches streamed text deltas into phrases worth sending to speech synthesis.
 *
 * <p>A phrase ends:
 * <ul>
 *   <li>after sentence punctuation ({@code . ! ? ; :}) or a newline that is followed by
 *       whitespace, once at least {@code minChars} are buffered</li>
 *   <li>at the last whitespace before {@code maxChars} when no sentence boundary came in time</li>
 *   <li>at {@link #flush()}, for whatever remains</li>
 * </ul>
 * Phrases are returned in input order and stripped of surrounding whitespace.
 *
 * <p>Not thread-safe; owned by one synthesis stage.
 */
public final class PhraseAggregator {

    private final int minChars;
    private final int maxChars;
    private final StringBuilder buffer = new StringBuilder();

    public PhraseAggregator(int minChars, int maxChars) {
        if (minChars < 1 || maxChars < minChars) {
            throw new IllegalArgumentException("Require 1 <= minChars <= maxChars, got min=" + minChars
                    + ", max=" + maxChars);
        }
        this.minChars = minChars;
        this.maxChars = maxChars;
    }

    /**
     * Adds a delta and returns every phrase it completed.
     */
    public List<String> append(String delta) {
        buffer.append(delta);
        List<String> phrases = new ArrayList<>();
        int split;
        while ((split = nextSplit()) > 0) {
            String phrase = buffer.substring(0, split).strip();
            buffer.delete(0, split);
            if (!phrase.isEmpty()) {
                phrases.add(phrase);
            }
        }
        return phrases;
    }

    /**
     * Returns the remaining text as a final phrase, possibly empty, and clears the buffer.
     */
    public String flush() {
        String rest = buffer.toString().strip();
        buffer.setLength(0);
        return rest;
    }

    public void reset() {
        buffer.setLength(0);
    }

    public int bufferedChars() {
        return buffer.length();
    }

    private int nextSplit() {
        int length = buffer.length();
        for (int i = minChars - 1; i < length - 1; i++) {
            if (isBoundary(buffer.charAt(i)) && Character.isWhitespace(buffer.charAt(i + 1))) {
                return i + 1;
            }
        }
        if (length > maxChars) {
            for (int i = maxChars; i > 0; i--) {
                if (Character.isWhitespace(buffer.charAt(i))) {
                    return i;
                }
            }
            return maxChars;
        }
        return -1;
    }

    private static boolean isBoundary(char c) {
        return c == '.' || c == '!' || c == '?' || c == ';' || c == ':' || c == '\n';
    }
}
