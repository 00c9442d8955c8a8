package com.mainframe.dspf.model;

/**
 * Field usage, column 38 of a field line.
 */
public enum FieldUsage {
    INPUT('I'),
    OUTPUT('O'),
    BOTH('B'),
    HIDDEN('H'),
    MESSAGE('M'),
    PROGRAM('P');

    private final char code;

    FieldUsage(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * Blank defaults to BOTH; an unknown code also falls back to BOTH.
     */
    public static FieldUsage fromCode(char code) {
        char normalized = Character.toUpperCase(code);
        for (FieldUsage usage : values()) {
            if (usage.code == normalized) {
                return usage;
            }
        }
        return BOTH;
    }
}
