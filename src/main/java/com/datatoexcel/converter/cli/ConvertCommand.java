package com.datatoexcel.converter.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datatoexcel.converter.cli.exception.OptionsValidationException;
import com.datatoexcel.converter.cli.model.ConvertOptions;
import com.datatoexcel.converter.cli.model.ValidatedConvertOptions;
import com.datatoexcel.converter.cli.output.ConsoleProgressBar;
import com.datatoexcel.converter.cli.output.ConvertResultsPrinter;
import com.datatoexcel.converter.cli.validation.ConvertOptionsValidator;
import com.datatoexcel.converter.config.ConverterConfig;
import com.datatoexcel.converter.convert.ConversionResult;
import com.datatoexcel.converter.convert.ConversionService;
import com.datatoexcel.converter.convert.ProgressListener;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command converting a JSON, XML or YAML file into an Excel workbook of flattened tables.
 */
@Command(
        name = "data-to-excel",
        mixinStandardHelpOptions = true,
        version = "data-to-excel-converter 1.0.0",
        description = "Flattens a nested JSON, XML or YAML file into tables and writes each table to a sheet of an Excel workbook."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(options, validated);

        ConverterConfig config = ConverterConfig.builder()
                .inputPath(validated.getInputPath())
                .outputPath(validated.getOutputPath())
                .sourceFormat(validated.getSourceFormat())
                .namingRegistryPath(options.getNamingRegistry())
                .emptyTablePolicy(validated.getEmptyTablePolicy())
                .showProgress(!options.isNoProgress())
                .force(options.isForce())
                .build();

        ProgressListener progress = config.isShowProgress() ? new ConsoleProgressBar(System.out) : ProgressListener.NONE;

        ConversionResult result;
        try {
            result = new ConversionService(config).convert(progress);
        } catch (RuntimeException e) {
            log.error("Conversion failed with exception", e);
            return 1;
        }

        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }
        printer.printSuccess(result);
        return 0;
    }
}
