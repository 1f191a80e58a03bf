package com.localization.generator.codegen.model.input;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A flat key/text table loaded from one file. Entries keep file order;
 * a key defined twice in the same file appears once, with its last value.
 */
@Value
@Builder
public class StringsTable {

    @NonNull
    Path path;

    @NonNull
    TableFormat format;

    @Singular
    List<LocalizationEntry> entries;

    public int size() {
        return entries.size();
    }
}
