package com.mainframe.dspf.parser;

/**
 * Raised when keyword parameters cannot be read, e.g. an unbalanced DSPSIZ.
 * Callers in the parser convert it into a fallback value and a warning.
 */
public class DdsParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int lineIndex;

    public DdsParseException(String message, int lineIndex) {
        super(message);
        this.lineIndex = lineIndex;
    }

    public int getLineIndex() {
        return lineIndex;
    }
}
