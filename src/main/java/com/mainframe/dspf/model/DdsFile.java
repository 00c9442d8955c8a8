package com.mainframe.dspf.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Root of the element tree. Holds the file-level keywords (DSPSIZ, INDARA, CA03, ...).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DdsFile extends DdsOwnerElement {

    public DdsFile() {
        super(0, List.of());
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.FILE;
    }

    @Override
    public void accept(DdsElementVisitor visitor) {
        visitor.visit(this);
    }
}
