package com.mainframe.dspf.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A keyword entry, e.g. {@code DSPATR(HI)} or {@code COLOR(RED)}, possibly
 * conditioned by up to three indicators and possibly continued over several lines.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class DdsAttribute extends DdsElement {
    private String value;
    private List<DdsIndicator> indicators = new ArrayList<>();
    private int lastLineIndex;

    @Builder
    public DdsAttribute(int lineIndex, int lastLineIndex, String value, List<DdsIndicator> indicators) {
        this.lineIndex = lineIndex;
        this.lastLineIndex = Math.max(lineIndex, lastLineIndex);
        this.value = value != null ? value : "";
        this.indicators = indicators != null ? new ArrayList<>(indicators) : new ArrayList<>();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.ATTRIBUTE;
    }

    @Override
    public void accept(DdsElementVisitor visitor) {
        visitor.visit(this);
    }

    /**
     * Name of the first keyword in the value, upper-cased: {@code COLOR} for {@code COLOR(RED)}.
     */
    public String getKeyword() {
        List<String> keywords = getKeywords();
        return keywords.isEmpty() ? "" : keywords.get(0);
    }

    /**
     * Names of all keywords in the value. Parameters in parentheses and quoted text are skipped,
     * so {@code OVERLAY PROTECT} yields two names and {@code MSGCON(10 'A (B)')} yields one.
     */
    public List<String> getKeywords() {
        List<String> keywords = new ArrayList<>();
        if (value == null) {
            return keywords;
        }
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean quoted = false;
        for (char c : value.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && !quoted) {
                if (Character.isWhitespace(c)) {
                    flush(current, keywords);
                } else {
                    current.append(c);
                }
                continue;
            }
            if (depth > 0 || quoted) {
                flush(current, keywords);
            }
        }
        flush(current, keywords);
        return keywords;
    }

    public boolean hasKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return false;
        }
        return getKeywords().contains(keyword.trim().toUpperCase(Locale.ROOT));
    }

    private static void flush(StringBuilder current, List<String> keywords) {
        if (current.length() > 0) {
            keywords.add(current.toString().toUpperCase(Locale.ROOT));
            current.setLength(0);
        }
    }
}
