package com.mainframe.dspf.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for all DDS elements.
 * The line index is the 0-based source line where the element begins.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public abstract class DdsElement {
    protected int lineIndex;

    public abstract ElementKind getKind();

    public abstract void accept(DdsElementVisitor visitor);
}
