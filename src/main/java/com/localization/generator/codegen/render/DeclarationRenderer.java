package com.localization.generator.codegen.render;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.localization.generator.codegen.format.FormatClassifier;
import com.localization.generator.codegen.model.tree.InterpolationType;
import com.localization.generator.codegen.model.tree.LocalizationValue;
import com.localization.generator.codegen.model.tree.LocalizationValue.Localization;
import com.localization.generator.codegen.model.tree.LocalizationValue.Namespace;
import com.localization.generator.codegen.model.tree.Node;
import com.localization.generator.codegen.util.SourceEscapeUtil;

/**
 * Renders a sanitized accessor tree into Java declarations.
 *
 * Namespaces become classes (the level-0 node is the top-level class, deeper
 * ones are static nested classes); localizations become static accessor methods
 * documented with their text. Children are separated by one blank line and
 * indented four spaces per level, so identical trees always render identically.
 */
public class DeclarationRenderer {

    static final String INDENT = "    ";
    static final String PARAMETER_PREFIX = "value";

    private final FormatClassifier classifier;
    private final String lookupClassName;

    public DeclarationRenderer(String lookupClassName) {
        this(new FormatClassifier(), lookupClassName);
    }

    public DeclarationRenderer(FormatClassifier classifier, String lookupClassName) {
        this.classifier = classifier;
        this.lookupClassName = lookupClassName;
    }

    public String render(Node<LocalizationValue> node, int indentLevel) {
        LocalizationValue value = node.getValue();
        if (value instanceof Namespace namespace) {
            return renderNamespace(node, namespace, indentLevel);
        } else if (value instanceof Localization localization) {
            if (!node.isLeaf()) {
                throw new IllegalStateException("Localization node has children: " + localization);
            }
            return renderLocalization(localization, indentLevel);
        }
        throw new IllegalStateException("Unknown tree value: " + value);
    }

    private String renderNamespace(Node<LocalizationValue> node, Namespace namespace, int indentLevel) {
        String indent = indent(indentLevel);
        String body = node.getChildren().stream()
                .map(child -> render(child, indentLevel + 1))
                .collect(Collectors.joining("\n\n"));
        String modifiers = indentLevel == 0 ? "public final class " : "public static final class ";

        return indent + modifiers + namespace.getName() + " {\n"
                + body + "\n"
                + indent + "}";
    }

    private String renderLocalization(Localization localization, int indentLevel) {
        String indent = indent(indentLevel);
        StringBuilder sb = new StringBuilder();

        sb.append(indent).append("/**\n");
        for (String line : localization.getText().split("\\R", -1)) {
            String docLine = SourceEscapeUtil.javadocLine(line);
            sb.append(indent).append(" *");
            if (!docLine.isEmpty()) {
                sb.append(' ').append(docLine);
            }
            sb.append('\n');
        }
        sb.append(indent).append(" */\n");

        String key = SourceEscapeUtil.stringLiteral(localization.getKey());
        List<InterpolationType> types = classifier.classify(localization.getText());

        if (types.isEmpty()) {
            sb.append(indent).append("public static String ").append(localization.getName()).append("() {\n");
            sb.append(indent).append(INDENT)
                    .append("return ").append(lookupClassName).append(".localized(").append(key).append(");\n");
        } else {
            String parameters = IntStream.rangeClosed(1, types.size())
                    .mapToObj(i -> types.get(i - 1).getJavaType() + " " + PARAMETER_PREFIX + i)
                    .collect(Collectors.joining(", "));
            String arguments = IntStream.rangeClosed(1, types.size())
                    .mapToObj(i -> PARAMETER_PREFIX + i)
                    .collect(Collectors.joining(", "));

            sb.append(indent).append("public static String ").append(localization.getName())
                    .append("(").append(parameters).append(") {\n");
            sb.append(indent).append(INDENT)
                    .append("return ").append(lookupClassName).append(".format(").append(key)
                    .append(", ").append(arguments).append(");\n");
        }
        sb.append(indent).append("}");
        return sb.toString();
    }

    private static String indent(int level) {
        return INDENT.repeat(level);
    }
}
