package com.datatoexcel.converter.parser;

import java.io.IOException;
import java.io.Reader;

import com.datatoexcel.converter.model.ObjectNode;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses JSON or YAML through a Jackson tree model.
 */
public class JacksonDocumentParser implements DocumentParser {

    private final SourceFormat format;
    private final ObjectMapper mapper;
    private final JsonNodeConverter converter = new JsonNodeConverter();

    public JacksonDocumentParser(SourceFormat format, ObjectMapper mapper) {
        this.format = format;
        this.mapper = mapper.copy().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    @Override
    public SourceFormat getFormat() {
        return format;
    }

    @Override
    public ObjectNode parse(Reader reader) {
        JsonNode tree;
        try {
            tree = mapper.readTree(reader);
        } catch (JacksonException e) {
            throw new DocumentParseException("Invalid " + format.getLabel() + " document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read " + format.getLabel() + " document: " + e.getMessage(), e);
        }
        if (tree == null || tree.isMissingNode()) {
            throw new DocumentParseException("Document root must be an object, found empty document");
        }
        return DocumentParser.requireObject(converter.convert(tree));
    }
}
