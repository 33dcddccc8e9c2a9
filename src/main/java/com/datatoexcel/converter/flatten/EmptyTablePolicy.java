package com.datatoexcel.converter.flatten;

/**
 * What to do with a table that ends up without any column, for example a parent whose
 * only fields were lists that got split off into tables of their own.
 */
public enum EmptyTablePolicy {
    /** Omit zero-column tables from the result. */
    DROP_EMPTY,
    /** Keep zero-column tables; they are emitted with row numbers only. */
    KEEP_EMPTY
}
