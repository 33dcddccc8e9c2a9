package com.datatoexcel.converter.parser;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import lombok.Getter;

/**
 * Supported source document formats and the file extensions accepted for each.
 */
@Getter
public enum SourceFormat {
    JSON("json", List.of("json")),
    XML("xml", List.of("xml")),
    YML("yml", List.of("yml", "yaml"));

    private final String label;
    private final List<String> extensions;

    SourceFormat(String label, List<String> extensions) {
        this.label = label;
        this.extensions = extensions;
    }

    public boolean accepts(Path file) {
        String fileName = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return extensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
