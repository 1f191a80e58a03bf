package com.localization.generator.codegen.util;

import java.util.Set;

import javax.lang.model.SourceVersion;

/**
 * Utility for turning localization key segments into Java identifiers.
 */
public class NamingUtil {

    private static final char ESCAPE = '_';
    private static final String LOOKUP_CLASS_SUFFIX = "Bundle";

    /** Members of java.lang.Object that a static accessor must not hide or clash with. */
    private static final Set<String> OBJECT_MEMBER_NAMES = Set.of(
            "clone", "equals", "finalize", "getClass", "hashCode",
            "notify", "notifyAll", "toString", "wait");

    /** Types the generated compilation unit refers to by simple name. */
    private static final Set<String> REFERENCED_TYPE_NAMES = Set.of(
            "Matcher", "Object", "Pattern", "ResourceBundle", "String");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts an arbitrary key segment to a valid Java identifier.
     * Invalid characters become underscores, case is preserved, and a leading
     * underscore is added before a digit, a reserved word or the name of a
     * {@code java.lang.Object} method.
     * Examples: {@code "welcome-title" -> "welcome_title"}, {@code "2fa" -> "_2fa"},
     * {@code "class" -> "_class"}.
     */
    public static String toIdentifier(String segment) {
        if (segment == null || segment.isEmpty()) {
            return String.valueOf(ESCAPE).repeat(2);
        }

        StringBuilder sb = new StringBuilder(segment.length() + 1);
        segment.codePoints().forEach(cp -> {
            if (cp != '$' && Character.isJavaIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append(ESCAPE);
            }
        });

        String candidate = sb.toString();
        if (!Character.isJavaIdentifierStart(candidate.codePointAt(0)) || SourceVersion.isKeyword(candidate)
                || OBJECT_MEMBER_NAMES.contains(candidate)) {
            candidate = ESCAPE + candidate;
        }
        return candidate;
    }

    /**
     * Derives a different identifier from an already valid one by appending an
     * underscore. Never returns its input.
     */
    public static String underscored(String identifier) {
        return identifier + ESCAPE;
    }

    /**
     * Name of the package-private helper class generated next to the top-level class.
     */
    public static String lookupClassName(String topLevelName) {
        return topLevelName + LOOKUP_CLASS_SUFFIX;
    }

    /**
     * Whether {@code name} can be used as a simple class name.
     */
    public static boolean isValidTypeName(String name) {
        return name != null && SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name);
    }

    /**
     * Whether a top-level class called {@code name} would shadow or clash with a
     * type the generated compilation unit uses.
     */
    public static boolean isReferencedTypeName(String name) {
        return REFERENCED_TYPE_NAMES.contains(name);
    }

    /**
     * Whether {@code packageName} is a valid, possibly qualified, package name.
     */
    public static boolean isValidPackageName(String packageName) {
        return packageName != null && SourceVersion.isName(packageName);
    }
}
