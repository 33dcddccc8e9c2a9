package com.datatoexcel.converter.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * A flat, named table: an ordered set of equal-length columns.
 *
 * The name is the dotted path describing how the table was derived from the document.
 * Rows are numbered from {@link #getFirstRowNumber()}, which is 0 until the table is reindexed.
 */
public class Table {

    @Getter
    private final String name;
    private final Map<String, Column> columns = new LinkedHashMap<>();
    @Getter
    private int rowCount;
    @Getter
    private final int firstRowNumber;

    public Table(String name) {
        this(name, 0, 0);
    }

    public Table(String name, int rowCount) {
        this(name, rowCount, 0);
    }

    private Table(String name, int rowCount, int firstRowNumber) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Table name must not be empty");
        }
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count must be >= 0. Got: " + rowCount);
        }
        this.name = name;
        this.rowCount = rowCount;
        this.firstRowNumber = firstRowNumber;
    }

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public Collection<Column> getColumns() {
        return Collections.unmodifiableCollection(columns.values());
    }

    public Optional<Column> getColumn(String columnName) {
        return Optional.ofNullable(columns.get(columnName));
    }

    public int getColumnCount() {
        return columns.size();
    }

    public boolean hasColumns() {
        return !columns.isEmpty();
    }

    public boolean hasColumn(String columnName) {
        return columns.containsKey(columnName);
    }

    public DocumentNode getCell(int row, String columnName) {
        Column column = columns.get(columnName);
        if (column == null) {
            throw new IllegalArgumentException("No column '" + columnName + "' in table " + name);
        }
        return column.get(row);
    }

    /**
     * Cells of one row in column order.
     */
    public List<DocumentNode> getRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for table " + name + " with " + rowCount + " rows");
        }
        List<DocumentNode> cells = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            cells.add(column.get(row));
        }
        return cells;
    }

    /**
     * Display number of the row at the given zero-based position.
     */
    public int rowNumber(int row) {
        return firstRowNumber + row;
    }

    public boolean containsListCells() {
        return columns.values().stream().anyMatch(Column::containsLists);
    }

    public void addColumn(String columnName, List<DocumentNode> cells) {
        if (columns.containsKey(columnName)) {
            throw new IllegalArgumentException("Duplicate column '" + columnName + "' in table " + name);
        }
        if (cells.size() != rowCount) {
            throw new IllegalArgumentException("Column '" + columnName + "' has " + cells.size()
                    + " cells but table " + name + " has " + rowCount + " rows");
        }
        columns.put(columnName, new Column(columnName, cells));
    }

    public void removeColumn(String columnName) {
        if (columns.remove(columnName) == null) {
            throw new IllegalArgumentException("No column '" + columnName + "' in table " + name);
        }
    }

    public void renameColumn(String oldName, String newName) {
        if (oldName.equals(newName)) {
            return;
        }
        if (!columns.containsKey(oldName)) {
            throw new IllegalArgumentException("No column '" + oldName + "' in table " + name);
        }
        if (columns.containsKey(newName)) {
            throw new IllegalArgumentException("Duplicate column '" + newName + "' in table " + name);
        }
        Map<String, Column> reordered = new LinkedHashMap<>();
        columns.forEach((key, column) -> {
            if (key.equals(oldName)) {
                reordered.put(newName, column.renamed(newName));
            } else {
                reordered.put(key, column);
            }
        });
        columns.clear();
        columns.putAll(reordered);
    }

    /**
     * Appends one row. Columns absent from the row get a null cell; columns not yet in the table
     * are added after the existing ones, with null cells for the earlier rows.
     */
    public void appendRow(Map<String, DocumentNode> row) {
        for (String columnName : row.keySet()) {
            if (!columns.containsKey(columnName)) {
                columns.put(columnName, new Column(columnName, Collections.nCopies(rowCount, ScalarNode.NULL)));
            }
        }
        for (Column column : columns.values()) {
            DocumentNode cell = row.get(column.getName());
            column.add(cell != null ? cell : ScalarNode.NULL);
        }
        rowCount++;
    }

    /**
     * Copy of this table without the given columns.
     */
    public Table withoutColumns(Collection<String> dropped) {
        Table copy = new Table(name, rowCount, firstRowNumber);
        columns.forEach((key, column) -> {
            if (!dropped.contains(key)) {
                copy.columns.put(key, new Column(key, column.getCells()));
            }
        });
        return copy;
    }

    /**
     * Copy of this table whose rows are numbered from the given value.
     */
    public Table withFirstRowNumber(int first) {
        Table copy = new Table(name, rowCount, first);
        columns.forEach((key, column) -> copy.columns.put(key, new Column(key, column.getCells())));
        return copy;
    }

    @Override
    public String toString() {
        return "Table[" + name + ", columns=" + columns.keySet() + ", rows=" + rowCount + "]";
    }
}
