package com.localization.generator.codegen.model.tree;

import java.util.Comparator;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Value held by a node of the accessor tree: either a namespace (a generated
 * nested class) or a localization (a generated accessor method).
 *
 * Ordering: every namespace sorts before every localization, then by name.
 * Localizations sharing a name fall back to key and text so that the order
 * never depends on the order in which tables were read.
 */
public sealed interface LocalizationValue extends TreeValue
        permits LocalizationValue.Namespace, LocalizationValue.Localization {

    Comparator<LocalizationValue> ORDER = Comparator
            .comparingInt(LocalizationValue::kindRank)
            .thenComparing(LocalizationValue::getName)
            .thenComparing(LocalizationValue::keyOf)
            .thenComparing(LocalizationValue::textOf);

    String getName();

    /**
     * Returns a copy carrying {@code name}; key and text are never renamed.
     */
    LocalizationValue withName(String name);

    private static int kindRank(LocalizationValue value) {
        return value instanceof Namespace ? 0 : 1;
    }

    private static String keyOf(LocalizationValue value) {
        return value instanceof Localization localization ? localization.getKey() : "";
    }

    private static String textOf(LocalizationValue value) {
        return value instanceof Localization localization ? localization.getText() : "";
    }

    @Value
    final class Namespace implements LocalizationValue {
        @With
        @NonNull
        String name;

        @Override
        public boolean isContainer() {
            return true;
        }
    }

    @Value
    final class Localization implements LocalizationValue {
        @With
        @NonNull
        String name;

        /** Runtime lookup key, exactly as read from the table. */
        @NonNull
        String key;

        /** Original text, possibly containing format placeholders. */
        @NonNull
        String text;

        @Override
        public boolean isContainer() {
            return false;
        }
    }
}
