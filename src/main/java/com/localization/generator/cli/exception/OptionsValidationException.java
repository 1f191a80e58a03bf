package com.localization.generator.cli.exception;

import java.util.List;

/**
 * Every problem found in the options of one {@code generate} invocation.
 * The message lists them one per line under a count header.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(describe(errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	private static String describe(List<String> errors) {
		StringBuilder sb = new StringBuilder();
		sb.append(errors.size()).append(errors.size() == 1 ? " invalid option:" : " invalid options:");
		for (String error : errors) {
			sb.append(System.lineSeparator()).append("  - ").append(error);
		}
		return sb.toString();
	}
}
