package com.mainframe.dspf.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Literal text placed at a screen position. The text keeps its quotes and may have
 * been assembled from several continued lines, the last of which is {@code lastLineIndex}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class DdsConstant extends DdsOwnerElement {
    private String text;
    private int row;
    private int column;
    private String recordName;
    private List<DdsIndicator> indicators = new ArrayList<>();
    private int lastLineIndex;

    @Builder
    public DdsConstant(String text, int row, int column, String recordName, int lineIndex,
                       int lastLineIndex, List<DdsIndicator> indicators, List<DdsAttribute> attributes) {
        super(lineIndex, attributes);
        this.text = text;
        this.row = row;
        this.column = column;
        this.recordName = recordName;
        this.indicators = indicators != null ? new ArrayList<>(indicators) : new ArrayList<>();
        this.lastLineIndex = Math.max(lineIndex, lastLineIndex);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.CONSTANT;
    }

    @Override
    public void accept(DdsElementVisitor visitor) {
        visitor.visit(this);
    }

    /**
     * The literal without its surrounding apostrophes.
     */
    public String getUnquotedText() {
        if (text != null && text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
