package com.datatoexcel.converter.flatten;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datatoexcel.converter.model.Column;
import com.datatoexcel.converter.model.DocumentNode;
import com.datatoexcel.converter.model.ListNode;
import com.datatoexcel.converter.model.ObjectNode;
import com.datatoexcel.converter.model.Table;

/**
 * Decomposes a nested document into flat tables.
 *
 * The root object is first projected onto a single row. Each of its list-valued fields becomes a
 * table named after the field; the remaining fields form the root table. Then, pass after pass,
 * every list-valued cell of every table is turned into a child table named
 * {@code <table>.<column><row>} (row counted from 1 within the parent table) and the expanded
 * column is dropped from its parent. Passes repeat until no table holds a list-valued cell.
 *
 * Each pass builds a fresh table mapping; tables are never mutated once they are in a mapping.
 */
public class FlatteningEngine {

    private static final Logger log = LoggerFactory.getLogger(FlatteningEngine.class);

    public static final String DEFAULT_ROOT_NAME = "ROOT";

    private final TabularProjection projection;
    private final EmptyTablePolicy emptyTablePolicy;

    public FlatteningEngine() {
        this(EmptyTablePolicy.DROP_EMPTY);
    }

    public FlatteningEngine(EmptyTablePolicy emptyTablePolicy) {
        this(new TabularProjection(), emptyTablePolicy);
    }

    public FlatteningEngine(TabularProjection projection, EmptyTablePolicy emptyTablePolicy) {
        this.projection = projection;
        this.emptyTablePolicy = emptyTablePolicy;
    }

    /**
     * Flattens the document into tables keyed by their path name.
     *
     * @param document the document root
     * @return tables in creation order; no cell of any table is list-valued
     * @throws FlatteningException when the document holds a list of lists or a list mixing scalars and objects
     */
    public Map<String, Table> flatten(ObjectNode document) {
        Map<String, Table> tables = splitFirstLevel(document);
        log.debug("First level split produced {} tables", tables.size());

        int pass = 0;
        ExpansionPass expansion;
        do {
            pass++;
            expansion = expand(tables);
            tables = expansion.tables;
            log.debug("Pass {}: expanded {} list cells, {} tables", pass, expansion.expandedCells, tables.size());
        } while (expansion.expandedCells > 0);

        return Collections.unmodifiableMap(applyEmptyTablePolicy(tables));
    }

    private Map<String, Table> splitFirstLevel(ObjectNode document) {
        Map<String, DocumentNode> record = projection.flattenRecord(document);

        Map<String, Table> children = new LinkedHashMap<>();
        Map<String, DocumentNode> rootCells = new LinkedHashMap<>();
        record.forEach((column, value) -> {
            if (value.isList()) {
                if (column.isEmpty()) {
                    throw FlatteningException.unnamedList();
                }
                register(children, projection.project(column, column, ((ListNode) value).getElements()));
            } else {
                rootCells.put(column, value);
            }
        });

        Table root = new Table(rootTableName(document, children.keySet()));
        root.appendRow(rootCells);

        Map<String, Table> tables = new LinkedHashMap<>();
        register(tables, root);
        children.values().forEach(child -> register(tables, child));
        return tables;
    }

    /**
     * The document's single top-level key when there is exactly one and no derived table uses it,
     * otherwise {@value #DEFAULT_ROOT_NAME}. When a top-level list already took that name, a numeric
     * suffix is appended until the name is free ({@code ROOT1}, {@code ROOT2}, ...).
     */
    static String rootTableName(ObjectNode document, Set<String> derivedNames) {
        if (document.size() == 1) {
            String key = document.fieldNames().iterator().next();
            if (!key.isEmpty() && !derivedNames.contains(key)) {
                return key;
            }
        }
        String name = DEFAULT_ROOT_NAME;
        for (int suffix = 1; derivedNames.contains(name); suffix++) {
            name = DEFAULT_ROOT_NAME + suffix;
        }
        return name;
    }

    private ExpansionPass expand(Map<String, Table> tables) {
        Map<String, Table> next = new LinkedHashMap<>();
        List<Table> created = new ArrayList<>();
        int expandedCells = 0;

        for (Table table : tables.values()) {
            List<String> expandedColumns = new ArrayList<>();
            for (Column column : table.getColumns()) {
                boolean expanded = false;
                for (int row = 0; row < column.size(); row++) {
                    DocumentNode cell = column.get(row);
                    if (cell.isList()) {
                        String childName = childTableName(table.getName(), column.getName(), row + 1);
                        created.add(projection.project(childName, column.getName(), ((ListNode) cell).getElements()));
                        expandedCells++;
                        expanded = true;
                    }
                }
                if (expanded) {
                    expandedColumns.add(column.getName());
                }
            }
            register(next, expandedColumns.isEmpty() ? table : table.withoutColumns(expandedColumns));
        }

        created.forEach(child -> register(next, child));
        return new ExpansionPass(next, expandedCells);
    }

    /**
     * Name of the table expanded from one list-valued cell. The scheme is not injective: column
     * {@code b} at row 11 and column {@code b1} at row 1 both give {@code <parent>.b11}. Such a clash
     * is reported as a {@link FlatteningException} when the second table is registered.
     */
    static String childTableName(String parentName, String columnName, int rowOrdinal) {
        return parentName + TabularProjection.PATH_SEPARATOR + columnName + rowOrdinal;
    }

    private Map<String, Table> applyEmptyTablePolicy(Map<String, Table> tables) {
        if (emptyTablePolicy == EmptyTablePolicy.KEEP_EMPTY) {
            return tables;
        }
        Map<String, Table> kept = new LinkedHashMap<>();
        tables.forEach((name, table) -> {
            if (table.hasColumns()) {
                kept.put(name, table);
            } else {
                log.debug("Dropping table {} without columns", name);
            }
        });
        return kept;
    }

    private static void register(Map<String, Table> tables, Table table) {
        if (tables.putIfAbsent(table.getName(), table) != null) {
            throw FlatteningException.duplicateTable(table.getName());
        }
    }

    private static final class ExpansionPass {
        private final Map<String, Table> tables;
        private final int expandedCells;

        private ExpansionPass(Map<String, Table> tables, int expandedCells) {
            this.tables = tables;
            this.expandedCells = expandedCells;
        }
    }
}
