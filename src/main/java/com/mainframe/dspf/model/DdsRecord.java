package com.mainframe.dspf.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * A record format (R in column 17). The end line is inclusive and is only known
 * once the whole document has been read.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class DdsRecord extends DdsOwnerElement {
    private String name;
    private int endLineIndex;
    private DdsSize size;

    @Builder
    public DdsRecord(String name, int lineIndex, int endLineIndex, DdsSize size, List<DdsAttribute> attributes) {
        super(lineIndex, attributes);
        this.name = name;
        this.endLineIndex = endLineIndex;
        this.size = size;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.RECORD;
    }

    @Override
    public void accept(DdsElementVisitor visitor) {
        visitor.visit(this);
    }

    public boolean containsLine(int index) {
        return index >= lineIndex && index <= endLineIndex;
    }
}
