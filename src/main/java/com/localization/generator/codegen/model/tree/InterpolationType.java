package com.localization.generator.codegen.model.tree;

/**
 * Parameter type inferred from one format placeholder.
 */
public enum InterpolationType {
    /**
     * {@code %u}. Java has no unsigned int, so the widest primitive is used.
     */
    UINT("long"),

    /**
     * {@code %d}, {@code %i}.
     */
    INT("int"),

    /**
     * {@code %ld}, {@code %lld}.
     */
    INT64("long"),

    /**
     * {@code %f}.
     */
    DOUBLE("double"),

    /**
     * {@code %@} and anything else.
     */
    STRING("String");

    private final String javaType;

    InterpolationType(String javaType) {
        this.javaType = javaType;
    }

    public String getJavaType() {
        return javaType;
    }

    /**
     * Classifies a matched placeholder token; the first matching rule wins.
     */
    public static InterpolationType fromPlaceholder(String token) {
        if (token.contains("ld")) {
            return INT64;
        } else if (token.contains("d") || token.contains("i")) {
            return INT;
        } else if (token.contains("u")) {
            return UINT;
        } else if (token.contains("f")) {
            return DOUBLE;
        }
        return STRING;
    }
}
