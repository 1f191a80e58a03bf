package com.localization.generator.codegen.table;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.codegen.exception.MalformedTableException;
import com.localization.generator.codegen.model.input.LocalizationEntry;

/**
 * Parser for Apple {@code .strings} files.
 *
 * Accepts {@code "key" = "value";} pairs, the {@code "key";} shorthand, unquoted
 * keys and values, {@code //} and block comments, and an optional enclosing
 * {@code { ... }}. Anything that is not a flat string table (nested dictionaries,
 * arrays, data, missing separators) is rejected. Files saved as XML property lists
 * are handed to {@link XmlPlistTableParser}.
 */
public class StringsTableParser implements TableParser {
    private static final Logger log = LoggerFactory.getLogger(StringsTableParser.class);

    private final XmlPlistTableParser plistParser = new XmlPlistTableParser();

    @Override
    public List<LocalizationEntry> parse(String content, Path path) throws MalformedTableException {
        if (isXml(content)) {
            return plistParser.parse(content, path);
        }
        return new Cursor(content, path).readTable();
    }

    private static boolean isXml(String content) {
        return content.replace("\uFEFF", "").stripLeading().startsWith("<");
    }

    /**
     * Scanning state for one file.
     */
    private static final class Cursor {
        private final String source;
        private final Path path;
        private int pos = 0;
        private int line = 1;
        private int column = 1;

        Cursor(String source, Path path) {
            this.source = source;
            this.path = path;
        }

        List<LocalizationEntry> readTable() throws MalformedTableException {
            Map<String, String> entries = new LinkedHashMap<>();

            skipTrivia();
            boolean braced = peek() == '{';
            if (braced) {
                advance();
            }

            while (true) {
                skipTrivia();
                if (isAtEnd()) {
                    if (braced) {
                        throw error("missing closing '}'");
                    }
                    break;
                }
                if (braced && peek() == '}') {
                    advance();
                    skipTrivia();
                    if (!isAtEnd()) {
                        throw error("unexpected content after closing '}'");
                    }
                    break;
                }

                String key = readString("key");
                skipTrivia();

                String value = key;
                if (peek() == '=') {
                    advance();
                    skipTrivia();
                    value = readString("value for key '" + key + "'");
                    skipTrivia();
                }

                if (peek() != ';') {
                    throw error("expected ';' after entry '" + key + "'");
                }
                advance();

                String previous = entries.put(key, value);
                if (previous != null) {
                    log.debug("Key '{}' defined more than once in {}, keeping last value", key, path);
                }
            }

            return entries.entrySet().stream()
                    .map(e -> new LocalizationEntry(e.getKey(), e.getValue()))
                    .toList();
        }

        private String readString(String what) throws MalformedTableException {
            char c = peek();
            if (c == '"') {
                return readQuoted();
            }
            if (c == '{' || c == '(' || c == '<') {
                throw error(what + " is not a string");
            }
            if (!isUnquotedChar(c)) {
                throw error("expected " + what);
            }

            int start = pos;
            while (!isAtEnd() && isUnquotedChar(peek())) {
                advance();
            }
            return source.substring(start, pos);
        }

        private String readQuoted() throws MalformedTableException {
            int startLine = line;
            int startColumn = column;
            advance(); // opening quote

            StringBuilder sb = new StringBuilder();
            while (true) {
                if (isAtEnd()) {
                    throw new MalformedTableException(path,
                            "unterminated string starting at line " + startLine + ", column " + startColumn);
                }
                char c = advance();
                if (c == '"') {
                    return sb.toString();
                }
                if (c == '\\') {
                    readEscape(sb);
                } else {
                    sb.append(c);
                }
            }
        }

        private void readEscape(StringBuilder sb) throws MalformedTableException {
            if (isAtEnd()) {
                throw error("unterminated escape sequence");
            }
            char c = advance();
            switch (c) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case 'U', 'u' -> sb.append(readHexEscape());
                default -> {
                    if (c >= '0' && c <= '7') {
                        sb.append(readOctalEscape(c));
                    } else {
                        // \" \\ \' and unknown escapes stand for the character itself
                        sb.append(c);
                    }
                }
            }
        }

        private char readHexEscape() throws MalformedTableException {
            int value = 0;
            int digits = 0;
            while (digits < 4 && !isAtEnd() && Character.digit(peek(), 16) >= 0) {
                value = value * 16 + Character.digit(advance(), 16);
                digits++;
            }
            if (digits == 0) {
                throw error("invalid unicode escape");
            }
            return (char) value;
        }

        private char readOctalEscape(char first) {
            int value = first - '0';
            int digits = 1;
            while (digits < 3 && !isAtEnd() && peek() >= '0' && peek() <= '7') {
                value = value * 8 + (advance() - '0');
                digits++;
            }
            return (char) value;
        }

        private void skipTrivia() throws MalformedTableException {
            while (!isAtEnd()) {
                char c = peek();
                if (Character.isWhitespace(c) || c == '\uFEFF') {
                    advance();
                } else if (c == '/' && peekNext() == '/') {
                    while (!isAtEnd() && peek() != '\n') {
                        advance();
                    }
                } else if (c == '/' && peekNext() == '*') {
                    int startLine = line;
                    advance();
                    advance();
                    while (!(peek() == '*' && peekNext() == '/')) {
                        if (isAtEnd()) {
                            throw new MalformedTableException(path,
                                    "unterminated comment starting at line " + startLine);
                        }
                        advance();
                    }
                    advance();
                    advance();
                } else {
                    return;
                }
            }
        }

        private static boolean isUnquotedChar(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '_' || c == '$' || c == '+' || c == '/' || c == ':' || c == '.' || c == '-';
        }

        private boolean isAtEnd() {
            return pos >= source.length();
        }

        private char peek() {
            return isAtEnd() ? '\0' : source.charAt(pos);
        }

        private char peekNext() {
            return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
        }

        private char advance() {
            char c = source.charAt(pos++);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return c;
        }

        private MalformedTableException error(String message) {
            return new MalformedTableException(path, message + " at line " + line + ", column " + column);
        }
    }
}
