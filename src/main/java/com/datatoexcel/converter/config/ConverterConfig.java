package com.datatoexcel.converter.config;

import java.nio.file.Path;

import com.datatoexcel.converter.flatten.EmptyTablePolicy;
import com.datatoexcel.converter.parser.SourceFormat;

import lombok.Builder;
import lombok.Data;

/**
 * Settings of one conversion run.
 */
@Data
@Builder
public class ConverterConfig {

    /**
     * Source document to convert.
     */
    private Path inputPath;

    /**
     * Workbook to create.
     */
    private Path outputPath;

    private SourceFormat sourceFormat;

    /**
     * Naming registry file; the bundled registry is used when null.
     */
    private Path namingRegistryPath;

    @Builder.Default
    private EmptyTablePolicy emptyTablePolicy = EmptyTablePolicy.DROP_EMPTY;

    @Builder.Default
    private boolean showProgress = true;

    /**
     * Whether an existing output file may be replaced.
     */
    private boolean force;
}
