package com.mainframe.dspf.parser;

/**
 * Shape of a physical DDS line as decided by {@link LineClassifier}.
 */
public enum LineKind {
    COMMENT,
    RECORD,
    FIELD,
    CONSTANT,
    ATTRIBUTE,
    BLANK
}
