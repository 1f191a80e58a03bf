package com.localization.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.cli.model.GenerateOptions;
import com.localization.generator.cli.model.ValidatedGenerateOptions;
import com.localization.generator.codegen.GeneratorResult;
import com.localization.generator.codegen.model.core.context.GenerationStats;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Localization Accessor Generator");
        log.info("=================================================");
        log.info("Inputs:");
        v.getNormalizedInputs().forEach(input -> log.info("  {}", input));
        log.info("Locale: {}", o.getLocale());
        log.info("Top-Level Class: {}", o.getTopLevelName());
        log.info("Package: {}", v.getPackageName() != null ? v.getPackageName() : "(default)");
        log.info("Resource Bundle: {}", o.getBundleName());
        log.info("Output: {}", v.getNormalizedOutput());
        if (o.isDryRun()) {
            log.info("Dry Run: no files will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(GenerateOptions o, GeneratorResult result) {
        if (result.isNothingToGenerate()) {
            log.info("");
            log.info("No localization tables found for locale '{}'. Nothing was generated.", o.getLocale());
            return;
        }

        GenerationStats stats = result.getStats();

        log.info("");
        log.info("=================================================");
        if (result.isWritten()) {
            log.info("GENERATION SUCCESSFUL");
        } else if (o.isDryRun()) {
            log.info("GENERATION SUCCESSFUL (DRY RUN)");
        } else {
            log.info("GENERATION SUCCESSFUL (OUTPUT UP TO DATE)");
        }
        log.info("=================================================");
        log.info("Output File: {}", result.getOutputPath());
        log.info("Tables Parsed: {}", stats.getTableCount());
        log.info("Entries Read: {}", stats.getEntryCount());
        log.info("Namespaces Generated: {}", stats.getNamespaceCount());
        log.info("Accessors Generated: {}", stats.getAccessorCount());
        log.info("  With Arguments: {}", stats.getParameterizedAccessorCount());

        if (stats.getRenameCount() > 0 || stats.getDuplicateKeyCount() > 0 || stats.getSkippedKeyCount() > 0) {
            log.info("");
            log.info("Naming Summary:");
            log.info("  Renamed To Avoid Collisions: {}", stats.getRenameCount());
            log.info("  Keys Defined In Several Tables: {}", stats.getDuplicateKeyCount());
            log.info("  Keys Skipped (No Name Segments): {}", stats.getSkippedKeyCount());
        }

        log.info("");
        log.info("Generation Time: {} ms", stats.getGenerationTimeMillis());
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        if (result.getFailingPath() != null) {
            log.error("Failing table: {}", result.getFailingPath());
        }
    }
}
