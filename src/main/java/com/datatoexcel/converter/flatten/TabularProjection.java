package com.datatoexcel.converter.flatten;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.datatoexcel.converter.model.DocumentNode;
import com.datatoexcel.converter.model.ObjectNode;
import com.datatoexcel.converter.model.ScalarNode;
import com.datatoexcel.converter.model.Table;

/**
 * Projects list elements onto a single table, one row per element.
 *
 * Objects nested inside an element are folded into dotted column names ({@code bgr.oms});
 * lists are kept as list-valued cells for a later expansion pass. Columns appear in the order
 * they are first seen across the elements and missing fields become null cells.
 */
public class TabularProjection {

    static final String PATH_SEPARATOR = ".";

    /**
     * Builds a table from the elements of a list.
     *
     * @param tableName        name of the table to create
     * @param scalarColumnName column name used when the elements are scalars
     * @param elements         the list elements
     * @return a table with one row per element; no columns at all when the list is empty
     * @throws FlatteningException when an element is itself a list, or scalars and objects are mixed
     */
    public Table project(String tableName, String scalarColumnName, List<DocumentNode> elements) {
        boolean hasObjects = false;
        boolean hasScalars = false;
        for (DocumentNode element : elements) {
            switch (element.getKind()) {
                case LIST -> throw FlatteningException.listOfLists(tableName);
                case OBJECT -> hasObjects = true;
                case SCALAR -> hasScalars |= !isNull(element);
            }
        }
        if (hasObjects && hasScalars) {
            throw FlatteningException.mixedList(tableName);
        }

        if (hasObjects) {
            Table table = new Table(tableName);
            for (DocumentNode element : elements) {
                // a null element among objects contributes an all-null row
                table.appendRow(element.isObject() ? flattenRecord((ObjectNode) element) : Map.of());
            }
            return table;
        }

        Table table = new Table(tableName, elements.size());
        if (!elements.isEmpty()) {
            table.addColumn(scalarColumnName, elements);
        }
        return table;
    }

    /**
     * Folds an object into one row: nested objects become dotted column names, everything else is
     * kept as-is. An empty nested object contributes no column.
     */
    public Map<String, DocumentNode> flattenRecord(ObjectNode record) {
        Map<String, DocumentNode> row = new LinkedHashMap<>();
        flattenInto("", record, row);
        return row;
    }

    private void flattenInto(String prefix, ObjectNode object, Map<String, DocumentNode> row) {
        object.getFields().forEach((field, value) -> {
            String column = prefix.isEmpty() ? field : prefix + PATH_SEPARATOR + field;
            if (value.isObject()) {
                flattenInto(column, (ObjectNode) value, row);
            } else {
                row.put(column, value);
            }
        });
    }

    private static boolean isNull(DocumentNode node) {
        return node instanceof ScalarNode scalar && scalar.isNull();
    }
}
