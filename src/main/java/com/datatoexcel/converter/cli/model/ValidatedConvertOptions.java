package com.datatoexcel.converter.cli.model;

import java.nio.file.Path;

import com.datatoexcel.converter.flatten.EmptyTablePolicy;
import com.datatoexcel.converter.parser.SourceFormat;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Path inputPath;
    Path outputPath;
    SourceFormat sourceFormat;
    EmptyTablePolicy emptyTablePolicy;
}
