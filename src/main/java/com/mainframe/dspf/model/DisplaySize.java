package com.mainframe.dspf.model;

import lombok.Value;

/**
 * A screen geometry declared by DSPSIZ, e.g. 24 x 80 named {@code *DS3}.
 * The name is empty when the geometry was declared without one.
 */
@Value
public class DisplaySize {
    public static final DisplaySize DS3 = new DisplaySize(24, 80, "*DS3");
    public static final DisplaySize DS4 = new DisplaySize(27, 132, "*DS4");

    int rows;
    int columns;
    String name;
}
