package com.localization.generator.codegen.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NamingUtil.
 */
class NamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "title, title",
            "welcome-title, welcome_title",
            "hello world, hello_world",
            "a$b, a_b",
            "2fa, _2fa",
            "class, _class",
            "null, _null",
            "toString, _toString",
            "hashCode, _hashCode",
            "WelcomeTitle, WelcomeTitle",
            "café, café"
    })
    void testToIdentifier(String segment, String expected) {
        assertThat(NamingUtil.toIdentifier(segment)).isEqualTo(expected);
    }

    @Test
    void testToIdentifierOfEmptySegmentIsUsable() {
        String identifier = NamingUtil.toIdentifier("");

        assertThat(identifier).isEqualTo("__");
        assertThat(NamingUtil.isValidTypeName(identifier)).isTrue();
    }

    @Test
    void testToIdentifierIsIdempotent() {
        for (String segment : new String[] {"welcome-title", "2fa", "class", "a.b", "~"}) {
            String once = NamingUtil.toIdentifier(segment);
            assertThat(NamingUtil.toIdentifier(once)).isEqualTo(once);
        }
    }

    @Test
    void testUnderscoredNeverReturnsItsInput() {
        assertThat(NamingUtil.underscored("title")).isEqualTo("title_");
        assertThat(NamingUtil.underscored("title_")).isEqualTo("title__");
        assertThat(NamingUtil.isValidTypeName(NamingUtil.underscored("_"))).isTrue();
    }

    @Test
    void testLookupClassName() {
        assertThat(NamingUtil.lookupClassName("Strings")).isEqualTo("StringsBundle");
    }

    @Test
    void testTypeAndPackageNameValidation() {
        assertThat(NamingUtil.isValidTypeName("Strings")).isTrue();
        assertThat(NamingUtil.isValidTypeName("class")).isFalse();
        assertThat(NamingUtil.isValidTypeName("1Strings")).isFalse();
        assertThat(NamingUtil.isValidTypeName(null)).isFalse();

        assertThat(NamingUtil.isReferencedTypeName("String")).isTrue();
        assertThat(NamingUtil.isReferencedTypeName("ResourceBundle")).isTrue();
        assertThat(NamingUtil.isReferencedTypeName("Strings")).isFalse();

        assertThat(NamingUtil.isValidPackageName("com.example.app")).isTrue();
        assertThat(NamingUtil.isValidPackageName("com..example")).isFalse();
        assertThat(NamingUtil.isValidPackageName("com.class")).isFalse();
    }
}
