package com.datatoexcel.converter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * A named sequence of cells, one per table row.
 */
public class Column {

    @Getter
    private final String name;
    private final List<DocumentNode> cells;

    Column(String name, List<DocumentNode> cells) {
        this.name = name;
        this.cells = new ArrayList<>(cells);
    }

    public List<DocumentNode> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public DocumentNode get(int row) {
        return cells.get(row);
    }

    public int size() {
        return cells.size();
    }

    public boolean containsLists() {
        return cells.stream().anyMatch(DocumentNode::isList);
    }

    void add(DocumentNode cell) {
        cells.add(cell);
    }

    Column renamed(String newName) {
        return new Column(newName, cells);
    }
}
