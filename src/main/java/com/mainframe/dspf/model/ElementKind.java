package com.mainframe.dspf.model;

/**
 * Kind tag carried by every parsed DDS element.
 */
public enum ElementKind {
    FILE,
    RECORD,
    FIELD,
    CONSTANT,
    ATTRIBUTE
}
