package com.datatoexcel.converter.parser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.datatoexcel.converter.model.DocumentNode;
import com.datatoexcel.converter.model.ObjectNode;

/**
 * Reads a source document into the generic document model.
 * The returned root is always an {@link ObjectNode}.
 */
public interface DocumentParser {

    SourceFormat getFormat();

    ObjectNode parse(Reader reader);

    default ObjectNode parse(String content) {
        return parse(new StringReader(content));
    }

    default ObjectNode parse(Path file) {
        requireFormat(getFormat(), file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    static void requireFormat(SourceFormat format, Path file) {
        if (!format.accepts(file)) {
            throw new DocumentParseException("This is no ." + format.getLabel() + " file: " + file);
        }
    }

    static ObjectNode requireObject(DocumentNode root) {
        if (root == null || !root.isObject()) {
            String kind = root == null ? "empty document" : root.getKind().name().toLowerCase();
            throw new DocumentParseException("Document root must be an object, found " + kind);
        }
        return (ObjectNode) root;
    }
}
