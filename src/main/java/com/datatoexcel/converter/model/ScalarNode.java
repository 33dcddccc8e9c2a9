package com.datatoexcel.converter.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A leaf value: string, number, boolean or null.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class ScalarNode extends DocumentNode {

    public static final ScalarNode NULL = new ScalarNode(null);

    private final Object value;

    private ScalarNode(Object value) {
        this.value = value;
    }

    public static ScalarNode of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported scalar type: " + value.getClass().getName());
        }
        return new ScalarNode(value);
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SCALAR;
    }

    @Override
    public <R> R accept(DocumentNodeVisitor<R> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
