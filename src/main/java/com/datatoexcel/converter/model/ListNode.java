package com.datatoexcel.converter.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An ordered list of nodes.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class ListNode extends DocumentNode {

    private final List<DocumentNode> elements;

    public ListNode(List<DocumentNode> elements) {
        this.elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST;
    }

    @Override
    public <R> R accept(DocumentNodeVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
