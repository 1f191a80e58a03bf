package com.localization.generator.codegen.util;

/**
 * Escaping helpers for text embedded in generated Java sources.
 */
public class SourceEscapeUtil {

    private SourceEscapeUtil() {
        // Utility class
    }

    /**
     * Returns {@code value} as a quoted Java string literal.
     */
    public static String stringLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Makes one line of text safe inside a Javadoc comment: the comment
     * terminator, backslashes and a leading block tag are neutralised.
     */
    public static String javadocLine(String line) {
        String escaped = line
                .replace("\\", "&#92;")
                .replace("*/", "*&#47;");
        if (escaped.stripLeading().startsWith("@")) {
            int at = escaped.indexOf('@');
            escaped = escaped.substring(0, at) + "{@literal @}" + escaped.substring(at + 1);
        }
        return escaped;
    }
}
