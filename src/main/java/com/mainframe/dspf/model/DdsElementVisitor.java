package com.mainframe.dspf.model;

/**
 * Visitor pattern interface for traversing parsed DDS elements.
 */
public interface DdsElementVisitor {
    void visit(DdsFile file);
    void visit(DdsRecord record);
    void visit(DdsField field);
    void visit(DdsConstant constant);
    void visit(DdsAttribute attribute);
}
