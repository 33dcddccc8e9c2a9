package com.datatoexcel.converter.flatten;

/**
 * Raised when a document contains a structure that cannot be normalized into tables,
 * or when flattening would break a table invariant.
 */
public class FlatteningException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FlatteningException(String message) {
        super(message);
    }

    static FlatteningException listOfLists(String tableName) {
        return new FlatteningException("List of lists cannot be normalized into a table: " + tableName);
    }

    static FlatteningException mixedList(String tableName) {
        return new FlatteningException("List mixes scalar and object elements and cannot be normalized into a table: "
                + tableName);
    }

    static FlatteningException duplicateTable(String tableName) {
        return new FlatteningException("Two derived tables share the name " + tableName);
    }

    static FlatteningException unnamedList() {
        return new FlatteningException("A top-level list under an empty field name cannot be named as a table");
    }
}
