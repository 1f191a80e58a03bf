package com.localization.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.cli.exception.OptionsValidationException;
import com.localization.generator.cli.model.GenerateOptions;
import com.localization.generator.cli.model.ValidatedGenerateOptions;
import com.localization.generator.cli.output.GenerateResultsPrinter;
import com.localization.generator.cli.validation.GenerateOptionsValidator;
import com.localization.generator.codegen.GeneratorResult;
import com.localization.generator.codegen.LocalizationGenerator;
import com.localization.generator.codegen.model.core.context.GeneratorConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating typed accessors from localization tables.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "localization-accessor-generator 1.0.0",
        description = "Generates a Java class with one strongly-typed accessor per localization key."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    private static final String BASE_LOGGER = "com.localization.generator";

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            if (options.isVerbose()) {
                enableDebugLogging();
            }

            ValidatedGenerateOptions validated;
            try {
                validated = validator.validate(options);
            } catch (OptionsValidationException e) {
                log.error(e.getMessage());
                return EXIT_INVALID_OPTIONS;
            }

            printer.printBanner(options, validated);

            GeneratorConfig config = toConfig(validated);
            GeneratorResult result = new LocalizationGenerator(config).generate();

            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_FAILURE;
            }

            printer.printSuccess(options, result);
            return EXIT_OK;

        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    private GeneratorConfig toConfig(ValidatedGenerateOptions v) {
        return GeneratorConfig.builder()
                .inputs(v.getNormalizedInputs())
                .locale(options.getLocale())
                .topLevelName(options.getTopLevelName())
                .packageName(v.getPackageName())
                .bundleName(options.getBundleName())
                .output(v.getNormalizedOutput())
                .force(options.isForce())
                .dryRun(options.isDryRun())
                .build();
    }

    private void enableDebugLogging() {
        Logger base = LoggerFactory.getLogger(BASE_LOGGER);
        if (base instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        } else {
            log.warn("--verbose has no effect: logging backend is not Logback");
        }
    }
}
