package com.mainframe.dspf.model;

import lombok.Value;

/**
 * A conditioning indicator (1-99). Inactive when the slot was prefixed with N.
 */
@Value
public class DdsIndicator {
    int number;
    boolean active;

    public static DdsIndicator of(int number, boolean active) {
        return new DdsIndicator(number, active);
    }
}
