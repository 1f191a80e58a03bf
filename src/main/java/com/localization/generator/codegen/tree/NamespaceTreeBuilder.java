package com.localization.generator.codegen.tree;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.codegen.model.tree.LocalizationValue;
import com.localization.generator.codegen.model.tree.LocalizationValue.Localization;
import com.localization.generator.codegen.model.tree.LocalizationValue.Namespace;
import com.localization.generator.codegen.model.tree.Node;
import com.localization.generator.codegen.util.NamingUtil;

/**
 * Builds the accessor tree by inserting dotted keys relative to a single root.
 *
 * Namespaces with the same sanitized name are merged; localizations never are,
 * so colliding names survive until the sanitize pass renames them apart.
 */
public class NamespaceTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(NamespaceTreeBuilder.class);

    private static final String KEY_SEPARATOR = "\\.";

    private final Node<LocalizationValue> root;

    public NamespaceTreeBuilder(String topLevelName) {
        this.root = new Node<>(new Namespace(topLevelName));
    }

    public Node<LocalizationValue> getRoot() {
        return root;
    }

    /**
     * Inserts one key/text pair.
     *
     * @return false when the key has no segments and was skipped
     */
    public boolean insert(String dottedKey, String text) {
        List<String> segments = Arrays.stream(dottedKey.split(KEY_SEPARATOR))
                .filter(segment -> !segment.isEmpty())
                .toList();

        if (segments.isEmpty()) {
            log.warn("Skipping key without name segments: '{}'", dottedKey);
            return false;
        }

        Node<LocalizationValue> current = root;
        for (String segment : segments.subList(0, segments.size() - 1)) {
            current = current.findOrAddContainer(new Namespace(NamingUtil.toIdentifier(segment)));
        }

        String leafName = NamingUtil.toIdentifier(segments.get(segments.size() - 1));
        current.addChild(new Node<>(new Localization(leafName, dottedKey, text)));
        return true;
    }
}
