package com.datatoexcel.converter.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * Factory for the parser of each {@link SourceFormat}.
 */
public final class DocumentParsers {

    private DocumentParsers() {
        // Utility class
    }

    public static DocumentParser forFormat(SourceFormat format) {
        return switch (format) {
            case JSON -> new JacksonDocumentParser(SourceFormat.JSON, new ObjectMapper());
            case YML -> new JacksonDocumentParser(SourceFormat.YML, new YAMLMapper());
            case XML -> new XmlDocumentParser();
        };
    }
}
