package com.mainframe.dspf.parser;

import lombok.Value;

/**
 * Row/column pair as stored on a field or constant. Either part may be null.
 */
@Value
public class ScreenPosition {
    Integer row;
    Integer column;
}
