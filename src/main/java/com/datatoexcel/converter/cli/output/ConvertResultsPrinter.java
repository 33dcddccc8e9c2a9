package com.datatoexcel.converter.cli.output;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datatoexcel.converter.cli.model.ConvertOptions;
import com.datatoexcel.converter.cli.model.ValidatedConvertOptions;
import com.datatoexcel.converter.convert.ConversionResult;

/**
 * Responsible only for printing CLI output for the convert command.
 * No validation, no execution.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("Data to Excel Converter");
        log.info("=================================================");
        log.info("Input File: {}", v.getInputPath());
        log.info("Input Type: {}", v.getSourceFormat().getLabel());
        log.info("Output File: {}", v.getOutputPath());
        log.info("Naming Registry: {}", o.getNamingRegistry() != null ? o.getNamingRegistry().toAbsolutePath() : "bundled");
        log.info("Empty Tables: {}", v.getEmptyTablePolicy());
        log.info("=================================================");
    }

    public void printSuccess(ConversionResult result) {
        log.info("Tables Flattened: {}", result.getTablesFlattened());
        log.info("Sheets Written: {}", result.getTablesWritten());
        log.info("Rows Written: {}", result.getRowsWritten());
        log.info("Excel file with tables created in {} seconds: {}",
                formatSeconds(result.getElapsed().toNanos()), result.getOutputPath());
    }

    public void printFailure(ConversionResult result) {
        log.error("This error happened: {}", result.getErrorMessage());
        log.error("Please try again.");
    }

    static String formatSeconds(long nanos) {
        return String.format(Locale.ROOT, "%.4f", nanos / 1_000_000_000.0);
    }
}
