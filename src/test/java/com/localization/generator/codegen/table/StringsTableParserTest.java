package com.localization.generator.codegen.table;

import java.nio.file.Path;
import java.util.List;

import com.localization.generator.codegen.exception.MalformedTableException;
import com.localization.generator.codegen.model.input.LocalizationEntry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the .strings parser.
 */
class StringsTableParserTest {

    private static final Path PATH = Path.of("en.lproj", "Localizable.strings");

    private final StringsTableParser parser = new StringsTableParser();

    @Test
    void testParseSimpleTable() throws MalformedTableException {
        String content = """
                /* Home screen */
                "home.title" = "Welcome";
                "home.subtitle" = "Glad you are here"; // trailing comment

                // Settings
                "settings.title"="Settings";
                """;

        List<LocalizationEntry> entries = parser.parse(content, PATH);

        assertThat(entries).containsExactly(
                new LocalizationEntry("home.title", "Welcome"),
                new LocalizationEntry("home.subtitle", "Glad you are here"),
                new LocalizationEntry("settings.title", "Settings"));
    }

    @Test
    void testParseEscapes() throws MalformedTableException {
        String content = """
                "multi" = "Line\\nTwo \\"quoted\\" caf\\U00e9 tab\\there \\\\ done";
                """;

        List<LocalizationEntry> entries = parser.parse(content, PATH);

        assertThat(entries).containsExactly(
                new LocalizationEntry("multi", "Line\nTwo \"quoted\" caf\u00e9 tab\there \\ done"));
    }

    @Test
    void testParseShorthandAndUnquoted() throws MalformedTableException {
        String content = """
                "OK";
                cancel = Cancel;
                "path" = /usr/local-bin;
                """;

        List<LocalizationEntry> entries = parser.parse(content, PATH);

        assertThat(entries).containsExactly(
                new LocalizationEntry("OK", "OK"),
                new LocalizationEntry("cancel", "Cancel"),
                new LocalizationEntry("path", "/usr/local-bin"));
    }

    @Test
    void testParseBracedTable() throws MalformedTableException {
        String content = "{\n  \"a\" = \"b\";\n}\n";

        assertThat(parser.parse(content, PATH)).containsExactly(new LocalizationEntry("a", "b"));
    }

    @Test
    void testParseEmptyTable() throws MalformedTableException {
        assertThat(parser.parse("", PATH)).isEmpty();
        assertThat(parser.parse("  // only a comment\n", PATH)).isEmpty();
        assertThat(parser.parse("\uFEFF", PATH)).isEmpty();
    }

    @Test
    void testLastDefinitionWins() throws MalformedTableException {
        String content = """
                "title" = "First";
                "other" = "Other";
                "title" = "Second";
                """;

        assertThat(parser.parse(content, PATH)).containsExactly(
                new LocalizationEntry("title", "Second"),
                new LocalizationEntry("other", "Other"));
    }

    @Test
    void testMissingSemicolonIsRejected() {
        String content = """
                "a" = "b"
                "c" = "d";
                """;

        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse(content, PATH))
                .withMessageContaining("expected ';' after entry 'a'")
                .withMessageContaining("line 2")
                .matches(e -> PATH.equals(e.getPath()));
    }

    @Test
    void testNestedValuesAreRejected() {
        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse("\"a\" = { \"b\" = \"c\"; };", PATH))
                .withMessageContaining("value for key 'a' is not a string");

        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse("\"a\" = (\"b\", \"c\");", PATH))
                .withMessageContaining("is not a string");
    }

    @Test
    void testXmlPropertyList() throws MalformedTableException {
        String content = """
                <?xml version="1.0" encoding="UTF-8"?>
                <!DOCTYPE plist PUBLIC "-//Apple//DTD PLIST 1.0//EN" "http://www.apple.com/DTDs/PropertyList-1.0.dtd">
                <plist version="1.0">
                <dict>
                    <key>home.title</key>
                    <string>Welcome, %@ &amp; friends</string>
                    <key>home.empty</key>
                    <string></string>
                    <key>home.title</key>
                    <string>Hello</string>
                </dict>
                </plist>
                """;

        List<LocalizationEntry> entries = parser.parse(content, PATH);

        assertThat(entries).containsExactly(
                new LocalizationEntry("home.title", "Hello"),
                new LocalizationEntry("home.empty", ""));
    }

    @Test
    void testXmlPropertyListWithNonStringValueIsRejected() {
        String content = """
                <?xml version="1.0" encoding="UTF-8"?>
                <plist version="1.0"><dict><key>count</key><integer>3</integer></dict></plist>
                """;

        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse(content, PATH))
                .withMessageContaining("value for key 'count' is not a string");
    }

    @Test
    void testBrokenXmlIsRejected() {
        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse("<plist><dict>", PATH))
                .withMessageContaining("invalid XML property list");

        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse("<plist><array/></plist>", PATH))
                .withMessageContaining("must contain exactly one <dict>");
    }

    @Test
    void testUnterminatedInputIsRejected() {
        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse("\"a\" = \"never closed;", PATH))
                .withMessageContaining("unterminated string starting at line 1, column 7");

        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse("/* open comment", PATH))
                .withMessageContaining("unterminated comment");

        assertThatExceptionOfType(MalformedTableException.class)
                .isThrownBy(() -> parser.parse("{ \"a\" = \"b\";", PATH))
                .withMessageContaining("missing closing '}'");
    }
}
