package com.datatoexcel.converter.output;

import java.io.Closeable;

import com.datatoexcel.converter.naming.LabelledTable;

/**
 * Receives labelled tables in emission order and materializes them.
 *
 * Nothing is visible at the destination before {@link #commit()} succeeds.
 */
public interface TableSink extends Closeable {

    void write(LabelledTable table);

    void commit();

    @Override
    void close();
}
