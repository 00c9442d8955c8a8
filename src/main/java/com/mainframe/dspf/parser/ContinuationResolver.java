package com.mainframe.dspf.parser;

import java.util.List;

/**
 * Joins keyword text and constant literals that run over several lines.
 *
 * Each line contributes its columns 45-80, right-trimmed. A segment ending in the
 * continuation marker loses the marker and pulls in the next line's segment; comment
 * lines in between are stepped over. Running out of lines simply ends the text.
 */
public class ContinuationResolver {

    private final char continuationMarker;
    private final LineClassifier classifier;

    public ContinuationResolver(char continuationMarker, LineClassifier classifier) {
        this.continuationMarker = continuationMarker;
        this.classifier = classifier;
    }

    public ContinuedText resolve(List<DdsLine> lines, int startIndex) {
        StringBuilder text = new StringBuilder();
        int index = startIndex;

        while (true) {
            String segment = lines.get(index)
                    .slice(DdsColumns.KEYWORDS_START, DdsColumns.KEYWORDS_END)
                    .stripTrailing();

            if (segment.isEmpty() || segment.charAt(segment.length() - 1) != continuationMarker) {
                text.append(segment);
                return new ContinuedText(text.toString().trim(), index, false);
            }

            text.append(segment, 0, segment.length() - 1);

            int next = nextContentLine(lines, index + 1);
            if (next < 0) {
                return new ContinuedText(text.toString().trim(), index, true);
            }
            index = next;
        }
    }

    private int nextContentLine(List<DdsLine> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            if (classifier.classify(lines.get(i)) != LineKind.COMMENT) {
                return i;
            }
        }
        return -1;
    }
}
