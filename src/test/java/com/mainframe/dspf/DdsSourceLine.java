package com.mainframe.dspf;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Builds one fixed-column DDS source line for tests. Columns are 1-based, as in the
 * DDS coding form; numeric slots are right-aligned.
 */
public final class DdsSourceLine {

    private final StringBuilder chars = new StringBuilder(" ".repeat(80));

    private DdsSourceLine() {
        put(6, "A");
    }

    public static DdsSourceLine line() {
        return new DdsSourceLine();
    }

    public static DdsSourceLine comment(String text) {
        return line().put(7, "*").put(8, text);
    }

    public static DdsSourceLine record(String name) {
        return line().put(17, "R").put(19, name);
    }

    public static DdsSourceLine field(String name) {
        return line().put(19, name);
    }

    public static DdsSourceLine constant(int row, int column, String text) {
        return line().position(row, column).keywords(text);
    }

    public static DdsSourceLine keyword(String text) {
        return line().keywords(text);
    }

    /**
     * Joins lines with {@code \n}, without a trailing newline.
     */
    public static String source(DdsSourceLine... lines) {
        return Arrays.stream(lines).map(DdsSourceLine::toString).collect(Collectors.joining("\n"));
    }

    public DdsSourceLine put(int column, String text) {
        int start = column - 1;
        while (chars.length() < start + text.length()) {
            chars.append(' ');
        }
        chars.replace(start, start + text.length(), text);
        return this;
    }

    public DdsSourceLine sequence(String number) {
        return put(1, number);
    }

    public DdsSourceLine indicators(String slots) {
        return put(8, slots);
    }

    public DdsSourceLine referenced() {
        return put(29, "R");
    }

    public DdsSourceLine length(int length) {
        return put(30, rightAligned(length, 5));
    }

    public DdsSourceLine type(char type) {
        return put(35, String.valueOf(type));
    }

    public DdsSourceLine decimals(int decimals) {
        return put(36, rightAligned(decimals, 2));
    }

    public DdsSourceLine usage(char usage) {
        return put(38, String.valueOf(usage));
    }

    public DdsSourceLine position(int row, int column) {
        return put(39, rightAligned(row, 3)).put(42, rightAligned(column, 3));
    }

    public DdsSourceLine keywords(String text) {
        return put(45, text);
    }

    @Override
    public String toString() {
        return chars.toString().stripTrailing();
    }

    private static String rightAligned(int value, int width) {
        String text = String.valueOf(value);
        return " ".repeat(Math.max(0, width - text.length())) + text;
    }
}
