package com.datatoexcel.converter.convert;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a conversion run.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int tablesFlattened;
    private int tablesWritten;
    private int rowsWritten;
    private Duration elapsed;

    /** Display names of the written sheets, in workbook order. */
    @Singular
    private List<String> sheetNames;

    public static ConversionResult failure(String errorMessage) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
