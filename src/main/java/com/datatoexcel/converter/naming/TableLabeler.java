package com.datatoexcel.converter.naming;

import java.util.ArrayList;
import java.util.List;

import com.datatoexcel.converter.model.Table;

import lombok.RequiredArgsConstructor;

/**
 * Resolves the display names of a table and its columns.
 *
 * A column whose raw name is a registered code is shown as {@code "<label> (<code>)"}; other columns
 * keep their raw name. A table whose raw path is registered is shown under its label, any other
 * table under its shortened path. Labels longer than the sheet name limit are shortened as well.
 */
@RequiredArgsConstructor
public class TableLabeler {

    private final NamingRegistry registry;

    public LabelledTable label(Table table) {
        List<String> columnLabels = new ArrayList<>(table.getColumnCount());
        for (String column : table.getColumnNames()) {
            columnLabels.add(columnLabel(column));
        }
        return new LabelledTable(displayName(table.getName()), table.getName(), columnLabels, table);
    }

    public String displayName(String rawPath) {
        return NameShortener.shorten(registry.tableLabel(rawPath).orElse(rawPath));
    }

    public String columnLabel(String code) {
        return registry.columnLabel(code)
                .map(label -> label + " (" + code + ")")
                .orElse(code);
    }
}
