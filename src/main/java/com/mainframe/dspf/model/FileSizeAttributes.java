package com.mainframe.dspf.model;

import lombok.Value;

import java.util.Optional;

/**
 * Document-level display sizes: the primary geometry always, the secondary one
 * only when DSPSIZ declared two.
 */
@Value
public class FileSizeAttributes {
    int displayCount;
    DisplaySize primary;
    DisplaySize secondary;
    boolean fallback;

    public static FileSizeAttributes fallback(DisplaySize defaultSize) {
        return new FileSizeAttributes(1, defaultSize, null, true);
    }

    public static FileSizeAttributes of(DisplaySize primary, DisplaySize secondary) {
        return new FileSizeAttributes(secondary != null ? 2 : 1, primary, secondary, false);
    }

    public Optional<DisplaySize> getSecondaryDisplay() {
        return Optional.ofNullable(secondary);
    }

    public int getMaxRows() {
        return secondary != null ? Math.max(primary.getRows(), secondary.getRows()) : primary.getRows();
    }

    public int getMaxColumns() {
        return secondary != null ? Math.max(primary.getColumns(), secondary.getColumns()) : primary.getColumns();
    }
}
