package com.mainframe.dspf.parser;

import lombok.Value;

/**
 * One physical source line with bounds-safe access to its fixed columns.
 * Slices past the end of a short line read as blanks.
 */
@Value
public class DdsLine {
    int index;
    String raw;
    String content;

    public static DdsLine of(int index, String raw, int sequenceAreaWidth) {
        String safe = raw != null ? raw : "";
        String content = safe.length() > sequenceAreaWidth ? safe.substring(sequenceAreaWidth) : "";
        return new DdsLine(index, safe, content);
    }

    public char charAt(int offset) {
        return offset >= 0 && offset < content.length() ? content.charAt(offset) : ' ';
    }

    public String slice(int start, int end) {
        if (start >= content.length()) {
            return "";
        }
        return content.substring(start, Math.min(end, content.length()));
    }

    public String sliceTrimmed(int start, int end) {
        return slice(start, end).trim();
    }

    public boolean isBlank(int start, int end) {
        return slice(start, end).isBlank();
    }

    /**
     * The slice as a non-negative integer, or null when it is blank or not all digits.
     */
    public Integer number(int start, int end) {
        String text = sliceTrimmed(start, end);
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * The slice as a positive integer, or null.
     */
    public Integer positiveNumber(int start, int end) {
        Integer value = number(start, end);
        return value != null && value > 0 ? value : null;
    }
}
