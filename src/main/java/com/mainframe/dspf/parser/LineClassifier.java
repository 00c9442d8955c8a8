package com.mainframe.dspf.parser;

import com.mainframe.dspf.model.core.context.DdsParserConfig;

/**
 * Decides what a single physical line encodes. Checks run in a fixed order:
 * comment, record header, field (named), constant (positioned), keyword line.
 */
public class LineClassifier {

    private final DdsParserConfig config;

    public LineClassifier(DdsParserConfig config) {
        this.config = config;
    }

    public LineKind classify(DdsLine line) {
        if (line.charAt(DdsColumns.COMMENT) == config.getCommentMarker()) {
            return LineKind.COMMENT;
        }
        if (Character.toUpperCase(line.charAt(DdsColumns.NAME_TYPE)) == config.getRecordMarker()) {
            return LineKind.RECORD;
        }
        if (!line.isBlank(DdsColumns.NAME_START, DdsColumns.NAME_END)) {
            return LineKind.FIELD;
        }
        if (isPositioned(line)) {
            return LineKind.CONSTANT;
        }
        if (!line.isBlank(DdsColumns.KEYWORDS_START, DdsColumns.KEYWORDS_END)) {
            return LineKind.ATTRIBUTE;
        }
        return LineKind.BLANK;
    }

    private boolean isPositioned(DdsLine line) {
        return line.positiveNumber(DdsColumns.ROW_START, DdsColumns.ROW_END) != null
                && line.positiveNumber(DdsColumns.COLUMN_START, DdsColumns.COLUMN_END) != null;
    }
}
