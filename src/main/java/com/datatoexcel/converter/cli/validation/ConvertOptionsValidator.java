package com.datatoexcel.converter.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.datatoexcel.converter.cli.exception.OptionsValidationException;
import com.datatoexcel.converter.cli.model.ConvertOptions;
import com.datatoexcel.converter.cli.model.ValidatedConvertOptions;
import com.datatoexcel.converter.flatten.EmptyTablePolicy;
import com.datatoexcel.converter.parser.SourceFormat;

public class ConvertOptionsValidator {

	static final String WORKBOOK_EXTENSION = ".xlsx";

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		SourceFormat format = o.getSourceFormat();
		if (format == null) {
			errors.add("One of --json, --xml or --yml must be provided.");
		}

		Path input = o.getInputPath();
		if (input == null) {
			errors.add("Input file is required (--inputpath / -i).");
		} else if (!Files.isRegularFile(input)) {
			errors.add("Input file does not exist or is not a file: " + input);
		} else if (format != null && !format.accepts(input)) {
			errors.add("This is no ." + format.getLabel() + " file: " + input);
		}

		if (o.getNamingRegistry() != null && !Files.isRegularFile(o.getNamingRegistry())) {
			errors.add("Naming registry does not exist or is not a file: " + o.getNamingRegistry());
		}

		Path output = o.getOutputPath() == null ? null : o.getOutputPath().toAbsolutePath().normalize();
		if (output == null) {
			errors.add("Output file is required (--outputpath / -o).");
		} else {
			if (!output.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(WORKBOOK_EXTENSION)) {
				errors.add("Output file must have the " + WORKBOOK_EXTENSION + " extension: " + output);
			}
			if (Files.isDirectory(output)) {
				errors.add("Output path is a directory: " + output);
			} else if (Files.exists(output) && !o.isForce()) {
				errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
			}
			if (input != null && Files.exists(input) && output.equals(input.toAbsolutePath().normalize())) {
				errors.add("Output file must differ from the input file: " + output);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		EmptyTablePolicy policy = o.isKeepEmptyTables() ? EmptyTablePolicy.KEEP_EMPTY : EmptyTablePolicy.DROP_EMPTY;
		return new ValidatedConvertOptions(input.toAbsolutePath().normalize(), output, format, policy);
	}
}
