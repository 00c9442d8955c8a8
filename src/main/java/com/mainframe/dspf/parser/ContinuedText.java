package com.mainframe.dspf.parser;

import lombok.Value;

/**
 * Text assembled by {@link ContinuationResolver} and the last physical line it consumed.
 * {@code unterminated} is set when the final segment still asked for a continuation.
 */
@Value
public class ContinuedText {
    String text;
    int lastLineIndex;
    boolean unterminated;

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
