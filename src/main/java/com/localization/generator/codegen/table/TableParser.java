package com.localization.generator.codegen.table;

import java.nio.file.Path;
import java.util.List;

import com.localization.generator.codegen.exception.MalformedTableException;
import com.localization.generator.codegen.model.input.LocalizationEntry;

/**
 * Parses the decoded contents of one table file into flat entries.
 */
public interface TableParser {

    /**
     * @param content decoded file contents
     * @param path    file the contents were read from, used in error messages
     */
    List<LocalizationEntry> parse(String content, Path path) throws MalformedTableException;
}
