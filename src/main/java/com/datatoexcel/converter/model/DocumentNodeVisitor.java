package com.datatoexcel.converter.model;

/**
 * Visitor pattern interface for traversing a parsed document.
 */
public interface DocumentNodeVisitor<R> {
    R visitScalar(ScalarNode scalar);
    R visitList(ListNode list);
    R visitObject(ObjectNode object);
}
