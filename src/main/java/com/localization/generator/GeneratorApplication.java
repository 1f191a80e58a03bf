package com.localization.generator;

import com.localization.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Entry point of the localization accessor generator: reads string tables and
 * writes a Java class with one typed accessor per key.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new GenerateCommand())
                .setUsageHelpAutoWidth(true)
                .execute(args);
    }
}
