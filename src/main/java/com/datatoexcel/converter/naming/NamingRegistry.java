package com.datatoexcel.converter.naming;

import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Read-only lookup of human-readable labels.
 *
 * Column codes and table paths live in two separate namespaces and match exactly;
 * a prefix or a single path segment never matches. A miss is not an error.
 */
@ToString
@EqualsAndHashCode
public final class NamingRegistry {

    private static final NamingRegistry EMPTY = new NamingRegistry(Map.of(), Map.of());

    private final Map<String, String> columnLabels;
    private final Map<String, String> tableLabels;

    public NamingRegistry(Map<String, String> columnLabels, Map<String, String> tableLabels) {
        this.columnLabels = Map.copyOf(columnLabels);
        this.tableLabels = Map.copyOf(tableLabels);
    }

    public static NamingRegistry empty() {
        return EMPTY;
    }

    public Optional<String> columnLabel(String code) {
        return Optional.ofNullable(columnLabels.get(code));
    }

    public Optional<String> tableLabel(String path) {
        return Optional.ofNullable(tableLabels.get(path));
    }

    public int columnCount() {
        return columnLabels.size();
    }

    public int tableCount() {
        return tableLabels.size();
    }
}
