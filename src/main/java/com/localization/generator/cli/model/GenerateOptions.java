package com.localization.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--input", "-i" }, required = true, paramLabel = "PATH",
			description = "Table file or directory to scan (repeatable)")
	private List<Path> inputs = new ArrayList<>();

	@Option(names = { "--locale", "-l" }, defaultValue = "en",
			description = "Locale to read: <locale>.lproj strings and _<locale> properties (default: en)")
	private String locale;

	@Option(names = { "--top-level-name", "-n" }, defaultValue = "Strings",
			description = "Name of the generated top-level class (default: Strings)")
	private String topLevelName;

	@Option(names = { "--package", "-p" }, description = "Package of the generated class (default package when omitted)")
	private String packageName;

	@Option(names = { "--bundle", "-b" }, defaultValue = "Localizable",
			description = "Resource bundle base name used at runtime (default: Localizable)")
	private String bundleName;

	@Option(names = { "--output", "-o" },
			description = "Output .java file, or source root directory (defaults to current directory)")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Build the source without writing it")
	private boolean dryRun;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;
}
