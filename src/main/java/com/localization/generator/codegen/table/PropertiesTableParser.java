package com.localization.generator.codegen.table;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import com.localization.generator.codegen.exception.MalformedTableException;
import com.localization.generator.codegen.model.input.LocalizationEntry;

/**
 * Parser for Java {@code .properties} files. Entries are returned sorted by key,
 * since {@link Properties} keeps no file order.
 */
public class PropertiesTableParser implements TableParser {

    @Override
    public List<LocalizationEntry> parse(String content, Path path) throws MalformedTableException {
        Properties properties = new Properties();
        try {
            properties.load(new StringReader(content));
        } catch (IllegalArgumentException e) {
            throw new MalformedTableException(path, e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedTableException(path, "unreadable properties content", e);
        }

        return properties.stringPropertyNames().stream()
                .sorted()
                .map(key -> new LocalizationEntry(key, properties.getProperty(key)))
                .toList();
    }
}
