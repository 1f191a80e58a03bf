package com.localization.generator.codegen.tree;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.codegen.model.tree.LocalizationValue;
import com.localization.generator.codegen.model.tree.LocalizationValue.Localization;
import com.localization.generator.codegen.model.tree.LocalizationValue.Namespace;
import com.localization.generator.codegen.model.tree.Node;
import com.localization.generator.codegen.util.NamingUtil;

/**
 * Collision resolution pass over the accessor tree.
 *
 * For every node, siblings are rescanned until stable:
 * - a child whose name was already seen n times among earlier siblings is underscored n times;
 * - a child named like its parent is underscored once;
 * - a namespace child named like any enclosing class, or like a reserved type name, is underscored once
 *   (Java rejects a nested class sharing the simple name of an enclosing class).
 * Only then are the children processed. Keys and texts are never touched.
 */
public class NamespaceTreeSanitizer {
    private static final Logger log = LoggerFactory.getLogger(NamespaceTreeSanitizer.class);

    private final Set<String> reservedTypeNames;
    private int renameCount;

    public NamespaceTreeSanitizer() {
        this(Set.of());
    }

    public NamespaceTreeSanitizer(Set<String> reservedTypeNames) {
        this.reservedTypeNames = Set.copyOf(reservedTypeNames);
    }

    /**
     * Sanitizes the tree in place.
     *
     * @return number of renames applied
     */
    public int sanitize(Node<LocalizationValue> root) {
        renameCount = 0;
        Set<String> enclosingTypeNames = new HashSet<>(reservedTypeNames);
        enclosingTypeNames.add(root.getValue().getName());
        sanitize(root, enclosingTypeNames);
        return renameCount;
    }

    private void sanitize(Node<LocalizationValue> node, Set<String> enclosingTypeNames) {
        String parentName = node.getValue().getName();

        boolean modified;
        do {
            modified = false;
            Map<String, Integer> seen = new HashMap<>();
            for (Node<LocalizationValue> child : node.getChildren()) {
                int occurrences = seen.getOrDefault(child.getValue().getName(), 0);
                for (int i = 0; i < occurrences; i++) {
                    underscore(child);
                    modified = true;
                }
                if (collidesWithEnclosingScope(child.getValue(), parentName, enclosingTypeNames)) {
                    underscore(child);
                    modified = true;
                }
                seen.merge(child.getValue().getName(), 1, Integer::sum);
            }
        } while (modified);

        for (Node<LocalizationValue> child : node.getChildren()) {
            if (child.getValue() instanceof Namespace namespace) {
                Set<String> nested = new HashSet<>(enclosingTypeNames);
                nested.add(namespace.getName());
                sanitize(child, nested);
            } else if (!child.isLeaf()) {
                throw new IllegalStateException("Localization node has children: " + child.getValue());
            }
        }
    }

    private boolean collidesWithEnclosingScope(LocalizationValue value, String parentName,
                                               Set<String> enclosingTypeNames) {
        if (value.getName().equals(parentName)) {
            return true;
        }
        return value instanceof Namespace && enclosingTypeNames.contains(value.getName());
    }

    private void underscore(Node<LocalizationValue> node) {
        LocalizationValue before = node.getValue();
        LocalizationValue after = before.withName(NamingUtil.underscored(before.getName()));
        node.setValue(after);
        renameCount++;

        if (log.isDebugEnabled()) {
            String key = before instanceof Localization localization ? localization.getKey() : "-";
            log.debug("Renamed '{}' to '{}' (key: {})", before.getName(), after.getName(), key);
        }
    }
}
