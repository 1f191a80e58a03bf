package com.localization.generator.codegen.table;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.codegen.exception.MalformedTableException;
import com.localization.generator.codegen.model.input.StringsTable;
import com.localization.generator.codegen.model.input.TableFormat;

/**
 * Loads table files, failing fast on the first file that is not a flat string table.
 */
public class TableLoadingService {
    private static final Logger log = LoggerFactory.getLogger(TableLoadingService.class);

    private final Map<TableFormat, TableParser> parsers;

    public TableLoadingService() {
        this(Map.of(
                TableFormat.STRINGS, new StringsTableParser(),
                TableFormat.PROPERTIES, new PropertiesTableParser()));
    }

    public TableLoadingService(Map<TableFormat, TableParser> parsers) {
        this.parsers = Map.copyOf(parsers);
    }

    /**
     * Loads every path in order. No table is returned if any of them is malformed.
     */
    public List<StringsTable> loadAll(List<Path> paths) throws MalformedTableException {
        List<StringsTable> tables = new ArrayList<>(paths.size());
        for (Path path : paths) {
            tables.add(load(path));
        }
        return tables;
    }

    public StringsTable load(Path path) throws MalformedTableException {
        TableFormat format = TableFormat.forPath(path)
                .orElseThrow(() -> new MalformedTableException(path, "unsupported file type"));
        TableParser parser = parsers.get(format);
        if (parser == null) {
            throw new MalformedTableException(path, "no parser registered for " + format);
        }

        String content = readText(path);
        log.info("Parsing table: {}", path.getFileName());
        StringsTable table = StringsTable.builder()
                .path(path)
                .format(format)
                .entries(parser.parse(content, path))
                .build();
        log.debug("Read {} entries from {}", table.size(), path);
        return table;
    }

    /**
     * Decodes a file using its byte order mark; files without one must be valid UTF-8.
     */
    private String readText(Path path) throws MalformedTableException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new MalformedTableException(path, "cannot be read (" + e.getMessage() + ")", e);
        }

        Charset charset = StandardCharsets.UTF_8;
        int offset = 0;
        if (startsWith(bytes, 0xEF, 0xBB, 0xBF)) {
            offset = 3;
        } else if (startsWith(bytes, 0xFE, 0xFF)) {
            charset = StandardCharsets.UTF_16BE;
            offset = 2;
        } else if (startsWith(bytes, 0xFF, 0xFE)) {
            charset = StandardCharsets.UTF_16LE;
            offset = 2;
        }

        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedTableException(path, "not valid " + charset.name() + " text", e);
        }
    }

    private static boolean startsWith(byte[] bytes, int... prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((bytes[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
