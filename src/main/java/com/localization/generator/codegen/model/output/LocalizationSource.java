package com.localization.generator.codegen.model.output;

import com.localization.generator.codegen.model.core.context.GenerationStats;

import lombok.NonNull;
import lombok.Value;

/**
 * Rendered declarations of the accessor tree plus what it took to build them.
 *
 * Pure structure only.
 */
@Value
public class LocalizationSource {

    @NonNull
    String declarations;

    @NonNull
    GenerationStats stats;
}
