package com.mainframe.dspf.model;

/**
 * Where a record's resolved size came from.
 */
public enum SizeSource {
    /**
     * The document's primary display size (DSPSIZ, or the 24x80 fallback).
     */
    DEFAULT,

    /**
     * The record's own WINDOW keyword.
     */
    WINDOW
}
