package com.datatoexcel.converter.naming;

import java.util.List;

import com.datatoexcel.converter.model.Table;

import lombok.Value;

/**
 * A table together with the names it is displayed under.
 * The underlying table is shared, not copied; only names differ.
 */
@Value
public class LabelledTable {
    String displayName;
    String rawName;
    List<String> columnLabels;
    Table table;

    public LabelledTable(String displayName, String rawName, List<String> columnLabels, Table table) {
        if (columnLabels.size() != table.getColumnCount()) {
            throw new IllegalArgumentException("Expected " + table.getColumnCount() + " column labels for table "
                    + rawName + " but got " + columnLabels.size());
        }
        this.displayName = displayName;
        this.rawName = rawName;
        this.columnLabels = List.copyOf(columnLabels);
        this.table = table;
    }
}
