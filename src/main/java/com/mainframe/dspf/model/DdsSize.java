package com.mainframe.dspf.model;

import lombok.Builder;
import lombok.Value;

/**
 * Resolved size of a record: its usable rows and columns plus the screen origin
 * used to translate record-relative coordinates.
 */
@Value
@Builder(toBuilder = true)
public class DdsSize {
    int rows;
    int columns;
    String name;
    SizeSource source;
    int originRow;
    int originColumn;

    public static DdsSize fromDisplay(DisplaySize display) {
        return DdsSize.builder()
                .rows(display.getRows())
                .columns(display.getColumns())
                .name(display.getName())
                .source(SizeSource.DEFAULT)
                .originRow(1)
                .originColumn(1)
                .build();
    }

    public static DdsSize window(int startRow, int startColumn, int rows, int columns) {
        return DdsSize.builder()
                .rows(rows)
                .columns(columns)
                .name("WINDOW_" + startRow + "_" + startColumn + "_" + rows + "_" + columns)
                .source(SizeSource.WINDOW)
                .originRow(startRow)
                .originColumn(startColumn)
                .build();
    }

    public boolean isWindow() {
        return source == SizeSource.WINDOW;
    }
}
