package com.datatoexcel.converter.cli.model;

import java.nio.file.Path;

import com.datatoexcel.converter.parser.SourceFormat;

import lombok.Getter;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the convert command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Option(names = { "-i", "--inputpath" }, required = true, description = "Path to the input file")
	private Path inputPath;

	@Option(names = { "-o", "--outputpath" }, required = true, description = "Path to the output file")
	private Path outputPath;

	@ArgGroup(exclusive = true, multiplicity = "1")
	private FormatSelection formatSelection;

	@Option(names = { "-r",
			"--naming-registry" }, description = "YAML file with column and table labels (defaults to the bundled registry)")
	private Path namingRegistry;

	@Option(names = {
			"--keep-empty-tables" }, description = "Also write tables left without columns after flattening")
	private boolean keepEmptyTables;

	@Option(names = { "--no-progress" }, description = "Do not display the progress bar")
	private boolean noProgress;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	public SourceFormat getSourceFormat() {
		return formatSelection == null ? null : formatSelection.toSourceFormat();
	}

	/**
	 * Exactly one of the input type flags.
	 */
	static class FormatSelection {

		@Option(names = { "-j", "--json" }, required = true, description = "Input file is a .json file")
		boolean json;

		@Option(names = { "-x", "--xml" }, required = true, description = "Input file is a .xml file")
		boolean xml;

		@Option(names = { "-y", "--yml" }, required = true, description = "Input file is a .yml file")
		boolean yml;

		SourceFormat toSourceFormat() {
			if (json) {
				return SourceFormat.JSON;
			}
			if (xml) {
				return SourceFormat.XML;
			}
			return SourceFormat.YML;
		}
	}
}
