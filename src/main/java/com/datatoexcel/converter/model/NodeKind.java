package com.datatoexcel.converter.model;

/**
 * Structural tag of a {@link DocumentNode}.
 */
public enum NodeKind {
    SCALAR,
    LIST,
    OBJECT
}
