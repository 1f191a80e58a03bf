package com.localization.generator.codegen.tree;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.localization.generator.codegen.model.tree.LocalizationValue;
import com.localization.generator.codegen.model.tree.LocalizationValue.Localization;
import com.localization.generator.codegen.model.tree.LocalizationValue.Namespace;
import com.localization.generator.codegen.model.tree.Node;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for collision resolution.
 */
class NamespaceTreeSanitizerTest {

    @Test
    void testCollidingSiblingsAreRenamedApart() {
        NamespaceTreeBuilder builder = new NamespaceTreeBuilder("Strings");
        builder.insert("a-b", "dash");
        builder.insert("a_b", "underscore");
        Node<LocalizationValue> root = builder.getRoot();
        root.sort(LocalizationValue.ORDER);

        int renames = new NamespaceTreeSanitizer().sanitize(root);

        assertThat(renames).isEqualTo(1);
        assertThat(localizations(root)).extracting(Localization::getName, Localization::getKey)
                .containsExactly(tuple("a_b", "a-b"), tuple("a_b_", "a_b"));
    }

    @Test
    void testCascadingCollisionsAreResolved() {
        Node<LocalizationValue> root = new Node<>(new Namespace("Strings"));
        root.addChild(leaf("x", "k1"));
        root.addChild(leaf("x", "k2"));
        root.addChild(leaf("x", "k3"));
        root.addChild(leaf("x_", "k4"));

        new NamespaceTreeSanitizer().sanitize(root);

        List<String> names = root.getChildren().stream().map(n -> n.getValue().getName()).toList();
        assertThat(names).doesNotHaveDuplicates().hasSize(4);
        assertThat(localizations(root)).extracting(Localization::getKey).containsExactly("k1", "k2", "k3", "k4");
    }

    @Test
    void testChildNamedLikeParentIsRenamed() {
        NamespaceTreeBuilder builder = new NamespaceTreeBuilder("Strings");
        builder.insert("Strings", "Top");
        builder.insert("menu.menu", "Menu");
        Node<LocalizationValue> root = builder.getRoot();

        new NamespaceTreeSanitizer().sanitize(root);

        assertThat(root.stream().map(n -> n.getValue().getName()))
                .containsExactly("Strings", "Strings_", "menu", "menu_");
    }

    @Test
    void testNestedClassNamedLikeEnclosingClassIsRenamed() {
        NamespaceTreeBuilder builder = new NamespaceTreeBuilder("Strings");
        builder.insert("settings.Strings.title", "Title");
        builder.insert("settings.Strings", "Method names may repeat enclosing class names");
        Node<LocalizationValue> root = builder.getRoot();
        root.sort(LocalizationValue.ORDER);

        new NamespaceTreeSanitizer().sanitize(root);

        Node<LocalizationValue> settings = root.getChildren().get(0);
        assertThat(settings.getChildren()).extracting(Node::getValue).containsExactly(
                new Namespace("Strings_"),
                new Localization("Strings", "settings.Strings", "Method names may repeat enclosing class names"));
    }

    @Test
    void testReservedTypeNamesAreAvoidedForNamespacesOnly() {
        NamespaceTreeBuilder builder = new NamespaceTreeBuilder("Strings");
        builder.insert("String.label", "Label");
        builder.insert("StringsBundle", "Leaf");
        builder.insert("StringsBundle.nested", "Nested");
        Node<LocalizationValue> root = builder.getRoot();
        root.sort(LocalizationValue.ORDER);

        new NamespaceTreeSanitizer(Set.of("String", "StringsBundle")).sanitize(root);

        assertThat(root.getChildren()).extracting(n -> n.getValue().getName())
                .containsExactly("String_", "StringsBundle_", "StringsBundle");
    }

    @Test
    void testSanitizedTreeHasUniqueSiblingNamesAndKeepsKeys() {
        NamespaceTreeBuilder builder = new NamespaceTreeBuilder("Strings");
        List<String> keys = List.of("a.b", "a-b", "a_b", "a.b", "a.a", "a.a.a", "A", "a", "class", "_class");
        for (String key : keys) {
            builder.insert(key, "text for " + key);
        }
        Node<LocalizationValue> root = builder.getRoot();
        root.sort(LocalizationValue.ORDER);

        new NamespaceTreeSanitizer().sanitize(root);

        root.stream().forEach(node -> {
            Set<String> siblings = new HashSet<>();
            for (Node<LocalizationValue> child : node.getChildren()) {
                assertThat(siblings.add(child.getValue().getName()))
                        .as("duplicate name %s under %s", child.getValue().getName(), node.getValue().getName())
                        .isTrue();
                assertThat(child.getValue().getName()).isNotEqualTo(node.getValue().getName());
            }
        });
        assertThat(localizations(root).stream().map(Localization::getKey).collect(Collectors.toList()))
                .containsExactlyInAnyOrderElementsOf(keys);
    }

    private static Node<LocalizationValue> leaf(String name, String key) {
        return new Node<>(new Localization(name, key, key));
    }

    private static List<Localization> localizations(Node<LocalizationValue> root) {
        return root.stream()
                .map(Node::getValue)
                .filter(Localization.class::isInstance)
                .map(Localization.class::cast)
                .toList();
    }
}
