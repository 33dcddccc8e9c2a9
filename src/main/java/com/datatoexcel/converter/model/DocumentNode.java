package com.datatoexcel.converter.model;

/**
 * Base class for all nodes of a parsed source document.
 *
 * A document is an immutable tree of objects (ordered field mappings), lists and scalars.
 * Flattening dispatches on {@link #getKind()} or through a {@link DocumentNodeVisitor}.
 */
public abstract class DocumentNode {

    public abstract NodeKind getKind();

    public abstract <R> R accept(DocumentNodeVisitor<R> visitor);

    public boolean isScalar() {
        return getKind() == NodeKind.SCALAR;
    }

    public boolean isList() {
        return getKind() == NodeKind.LIST;
    }

    public boolean isObject() {
        return getKind() == NodeKind.OBJECT;
    }
}
