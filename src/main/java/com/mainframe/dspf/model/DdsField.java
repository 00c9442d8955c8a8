package com.mainframe.dspf.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A named input/output field. Row and column are null for hidden fields.
 * The owning record name is null when the field precedes every record.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class DdsField extends DdsOwnerElement {
    private String name;
    private char type;
    private int length;
    private int decimals;
    private FieldUsage usage = FieldUsage.BOTH;
    private Integer row;
    private Integer column;
    private boolean referenced;
    private String recordName;
    private List<DdsIndicator> indicators = new ArrayList<>();
    private int lastLineIndex;

    @Builder
    public DdsField(String name, char type, int length, int decimals, FieldUsage usage,
                    Integer row, Integer column, boolean referenced, String recordName,
                    int lineIndex, int lastLineIndex, List<DdsIndicator> indicators,
                    List<DdsAttribute> attributes) {
        super(lineIndex, attributes);
        this.name = name;
        this.type = type;
        this.length = length;
        this.decimals = decimals;
        this.usage = usage != null ? usage : FieldUsage.BOTH;
        this.row = row;
        this.column = column;
        this.referenced = referenced;
        this.recordName = recordName;
        this.indicators = indicators != null ? new ArrayList<>(indicators) : new ArrayList<>();
        this.lastLineIndex = Math.max(lineIndex, lastLineIndex);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.FIELD;
    }

    @Override
    public void accept(DdsElementVisitor visitor) {
        visitor.visit(this);
    }

    public boolean isHidden() {
        return usage == FieldUsage.HIDDEN;
    }
}
