package com.localization.generator.codegen;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.codegen.exception.MalformedTableException;
import com.localization.generator.codegen.format.FormatClassifier;
import com.localization.generator.codegen.model.core.context.GenerationStats;
import com.localization.generator.codegen.model.input.LocalizationEntry;
import com.localization.generator.codegen.model.input.StringsTable;
import com.localization.generator.codegen.model.output.LocalizationSource;
import com.localization.generator.codegen.model.tree.LocalizationValue;
import com.localization.generator.codegen.model.tree.LocalizationValue.Localization;
import com.localization.generator.codegen.model.tree.LocalizationValue.Namespace;
import com.localization.generator.codegen.model.tree.Node;
import com.localization.generator.codegen.render.DeclarationRenderer;
import com.localization.generator.codegen.table.TableLoadingService;
import com.localization.generator.codegen.tree.NamespaceTreeBuilder;
import com.localization.generator.codegen.tree.NamespaceTreeSanitizer;
import com.localization.generator.codegen.util.NamingUtil;

/**
 * Turns localization tables into accessor declarations:
 * load all tables, insert every entry, sort, sanitize, render.
 *
 * Every run recomputes the whole tree. A malformed table aborts the run
 * before anything is rendered.
 */
public class LocalizationSourceBuilder {
    private static final Logger log = LoggerFactory.getLogger(LocalizationSourceBuilder.class);

    /** Type names referenced by generated accessors that nested classes must not shadow. */
    private static final Set<String> REFERENCED_TYPE_NAMES = Set.of("String");

    private final TableLoadingService loadingService;
    private final FormatClassifier classifier = new FormatClassifier();

    public LocalizationSourceBuilder() {
        this(new TableLoadingService());
    }

    public LocalizationSourceBuilder(TableLoadingService loadingService) {
        this.loadingService = loadingService;
    }

    /**
     * Builds the declarations for the tables at {@code paths}.
     *
     * @return the rendered top-level class, or empty when there are no tables
     * @throws MalformedTableException naming the first table that could not be parsed
     */
    public Optional<String> build(List<Path> paths, String topLevelName) throws MalformedTableException {
        return assemble(paths, topLevelName).map(LocalizationSource::getDeclarations);
    }

    /**
     * Same as {@link #build(List, String)}, keeping the statistics of the run.
     */
    public Optional<LocalizationSource> assemble(List<Path> paths, String topLevelName)
            throws MalformedTableException {
        long start = System.currentTimeMillis();

        List<StringsTable> tables = loadingService.loadAll(paths);
        if (tables.isEmpty()) {
            log.info("No localization tables found, nothing to generate");
            return Optional.empty();
        }

        NamespaceTreeBuilder treeBuilder = new NamespaceTreeBuilder(topLevelName);
        Set<String> seenKeys = new HashSet<>();
        int entryCount = 0;
        int skippedKeyCount = 0;
        int duplicateKeyCount = 0;

        for (StringsTable table : tables) {
            for (LocalizationEntry entry : table.getEntries()) {
                entryCount++;
                if (!seenKeys.add(entry.getKey())) {
                    duplicateKeyCount++;
                    log.warn("Key '{}' from {} is also defined in another table; both accessors are kept",
                            entry.getKey(), table.getPath().getFileName());
                }
                if (!treeBuilder.insert(entry.getKey(), entry.getText())) {
                    skippedKeyCount++;
                }
            }
        }

        Node<LocalizationValue> root = treeBuilder.getRoot();
        String lookupClassName = NamingUtil.lookupClassName(topLevelName);

        // First sort fixes which of two equal names gets renamed; the second restores order after renaming.
        root.sort(LocalizationValue.ORDER);
        Set<String> reservedTypeNames = new HashSet<>(REFERENCED_TYPE_NAMES);
        reservedTypeNames.add(lookupClassName);
        int renameCount = new NamespaceTreeSanitizer(reservedTypeNames).sanitize(root);
        root.sort(LocalizationValue.ORDER);

        String declarations = new DeclarationRenderer(classifier, lookupClassName).render(root, 0);

        GenerationStats stats = GenerationStats.builder()
                .tableCount(tables.size())
                .entryCount(entryCount)
                .skippedKeyCount(skippedKeyCount)
                .duplicateKeyCount(duplicateKeyCount)
                .namespaceCount((int) root.stream().filter(n -> n.getValue() instanceof Namespace).count() - 1)
                .accessorCount((int) root.stream().filter(n -> n.getValue() instanceof Localization).count())
                .parameterizedAccessorCount(countParameterized(root))
                .renameCount(renameCount)
                .generationTimeMillis(System.currentTimeMillis() - start)
                .build();

        log.debug("Built accessor tree: {}", stats);
        return Optional.of(new LocalizationSource(declarations, stats));
    }

    private int countParameterized(Node<LocalizationValue> root) {
        return (int) root.stream()
                .map(Node::getValue)
                .filter(Localization.class::isInstance)
                .map(Localization.class::cast)
                .filter(localization -> !classifier.classify(localization.getText()).isEmpty())
                .count();
    }
}
