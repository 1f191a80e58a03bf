package com.localization.generator.codegen.model.input;

import lombok.NonNull;
import lombok.Value;

/**
 * One resolved key/text pair read from a table.
 */
@Value
public class LocalizationEntry {

    /** Full dotted lookup key. */
    @NonNull
    String key;

    /** Raw value, possibly containing format placeholders. */
    @NonNull
    String text;
}
