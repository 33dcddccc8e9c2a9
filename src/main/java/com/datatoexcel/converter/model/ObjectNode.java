package com.datatoexcel.converter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.EqualsAndHashCode;

/**
 * An object: field names mapped to nodes, in insertion order.
 */
@EqualsAndHashCode(callSuper = false)
public final class ObjectNode extends DocumentNode {

    private final Map<String, DocumentNode> fields;

    public ObjectNode(Map<String, DocumentNode> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, DocumentNode> getFields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Optional<DocumentNode> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OBJECT;
    }

    @Override
    public <R> R accept(DocumentNodeVisitor<R> visitor) {
        return visitor.visitObject(this);
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
