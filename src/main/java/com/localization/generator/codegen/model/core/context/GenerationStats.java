package com.localization.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationStats {

    int tableCount;
    int entryCount;
    int skippedKeyCount;
    int duplicateKeyCount;
    int namespaceCount;
    int accessorCount;
    int parameterizedAccessorCount;
    int renameCount;

    long generationTimeMillis;
}
