package com.localization.generator.codegen;

import java.nio.file.Path;

import com.localization.generator.codegen.model.core.context.GenerationStats;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path failingPath;

    /** True when there were no tables, so nothing was generated. */
    private boolean nothingToGenerate;

    private Path outputPath;

    /** False on a dry run or when the file already held the same source. */
    private boolean written;
    private String source;

    private GenerationStats stats;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult tableFailure(Path failingPath, String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .failingPath(failingPath)
                .build();
    }

    public static GeneratorResult nothingToGenerate() {
        return GeneratorResult.builder()
                .success(true)
                .nothingToGenerate(true)
                .build();
    }
}
