package com.datatoexcel.converter.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renumbers table rows so that the first row is number 1.
 */
public class RowReindexer {

    public static final int FIRST_ROW_NUMBER = 1;

    public Table reindex(Table table) {
        return table.getFirstRowNumber() == FIRST_ROW_NUMBER ? table : table.withFirstRowNumber(FIRST_ROW_NUMBER);
    }

    public Map<String, Table> reindexAll(Map<String, Table> tables) {
        Map<String, Table> reindexed = new LinkedHashMap<>();
        tables.forEach((name, table) -> reindexed.put(name, reindex(table)));
        return reindexed;
    }
}
