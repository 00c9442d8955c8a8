package com.mainframe.dspf.parser;

import com.mainframe.dspf.model.DdsAttribute;

import java.util.List;

/**
 * Subfile records read their positions transposed: the value in the row columns is the
 * screen column and the value in the column columns is the row. This adapter owns the
 * subfile test and the swap; nothing else about coordinates changes.
 */
public class SubfileCoordinateAdapter {

    private final String subfileKeyword;

    public SubfileCoordinateAdapter(String subfileKeyword) {
        this.subfileKeyword = subfileKeyword;
    }

    public boolean isSubfile(List<DdsAttribute> attributes) {
        if (attributes == null) {
            return false;
        }
        return attributes.stream()
                .map(DdsAttribute::getValue)
                .anyMatch(v -> v != null && v.trim().equalsIgnoreCase(subfileKeyword));
    }

    public ScreenPosition adapt(boolean subfile, Integer row, Integer column) {
        if (subfile) {
            return new ScreenPosition(column, row);
        }
        return new ScreenPosition(row, column);
    }
}
