package com.datatoexcel.converter.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.datatoexcel.converter.model.DocumentNode;
import com.datatoexcel.converter.model.ListNode;
import com.datatoexcel.converter.model.ObjectNode;
import com.datatoexcel.converter.model.ScalarNode;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps a Jackson tree onto the document model, keeping field and element order.
 */
public class JsonNodeConverter {

    public DocumentNode convert(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ScalarNode.NULL;
        }
        if (node.isObject()) {
            Map<String, DocumentNode> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), convert(entry.getValue()));
            }
            return new ObjectNode(fields);
        }
        if (node.isArray()) {
            List<DocumentNode> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(convert(element));
            }
            return new ListNode(elements);
        }
        if (node.isNumber()) {
            return ScalarNode.of(node.numberValue());
        }
        if (node.isBoolean()) {
            return ScalarNode.of(node.booleanValue());
        }
        // text, binary and embedded values are kept as text
        return ScalarNode.of(node.asText());
    }
}
