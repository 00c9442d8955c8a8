package com.mainframe.dspf.parser;

/**
 * Column offsets of a DDS display file line, relative to the content area
 * (the line with its sequence-number area removed, so offset 0 is column 6).
 * End offsets are exclusive.
 */
final class DdsColumns {

    static final int FORM_TYPE = 0;
    static final int COMMENT = 1;
    static final int INDICATORS_START = 2;
    static final int INDICATORS_END = 11;
    static final int NAME_TYPE = 11;
    static final int NAME_START = 13;
    static final int NAME_END = 23;
    static final int REFERENCE = 23;
    static final int LENGTH_START = 24;
    static final int LENGTH_END = 29;
    static final int DATA_TYPE = 29;
    static final int DECIMALS_START = 30;
    static final int DECIMALS_END = 32;
    static final int USAGE = 32;
    static final int ROW_START = 33;
    static final int ROW_END = 36;
    static final int COLUMN_START = 36;
    static final int COLUMN_END = 39;
    static final int KEYWORDS_START = 39;
    static final int KEYWORDS_END = 75;

    private DdsColumns() {
        // Constants only
    }
}
