package com.localization.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.localization.generator.cli.exception.OptionsValidationException;
import com.localization.generator.cli.model.GenerateOptions;
import com.localization.generator.cli.model.ValidatedGenerateOptions;
import com.localization.generator.codegen.util.NamingUtil;

public class GenerateOptionsValidator {

	private static final Pattern LOCALE = Pattern.compile("[A-Za-z0-9_-]+");

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> inputs = new ArrayList<>();
		if (o.getInputs() == null || o.getInputs().isEmpty()) {
			errors.add("At least one input is required (--input / -i).");
		} else {
			for (Path input : o.getInputs()) {
				if (!Files.exists(input)) {
					errors.add("Input does not exist: " + input);
				} else {
					inputs.add(input.toAbsolutePath().normalize());
				}
			}
		}

		if (isBlank(o.getTopLevelName())) {
			errors.add("Top-level name is required (--top-level-name / -n).");
		} else if (!NamingUtil.isValidTypeName(o.getTopLevelName())) {
			errors.add("Top-level name is not a valid Java class name: " + o.getTopLevelName());
		} else if (NamingUtil.isReferencedTypeName(o.getTopLevelName())) {
			errors.add("Top-level name clashes with a type used by the generated code: " + o.getTopLevelName());
		}

		String packageName = isBlank(o.getPackageName()) ? null : o.getPackageName().trim();
		if (packageName != null && !NamingUtil.isValidPackageName(packageName)) {
			errors.add("Package is not a valid Java package name: " + o.getPackageName());
		}

		if (isBlank(o.getLocale()) || !LOCALE.matcher(o.getLocale()).matches()) {
			errors.add("Locale must contain only letters, digits, '_' or '-'. Got: " + o.getLocale());
		}

		if (isBlank(o.getBundleName())) {
			errors.add("Bundle name must not be blank (--bundle / -b).");
		}

		Path output = (o.getOutput() == null ? Path.of(".") : o.getOutput()).toAbsolutePath().normalize();

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(inputs, output, packageName);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
