package com.datatoexcel.converter;

import com.datatoexcel.converter.cli.ConvertCommand;
import picocli.CommandLine;

/**
 * Main entry point for the data-to-excel converter.
 * Flattens a nested JSON, XML or YAML document into tables and writes each table to its own
 * sheet of an Excel workbook.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand())
                .execute(args);
        System.exit(exitCode);
    }
}
