package com.localization.generator.codegen.format;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.localization.generator.codegen.model.tree.InterpolationType;

/**
 * Infers accessor parameter types from the printf-style placeholders of a text.
 *
 * Recognised tokens, left to right:
 * <ul>
 *   <li>{@code %[n$][flags][width][.precision][length](d|i|u|f)}, e.g. {@code %d}, {@code %.2f}, {@code %ld}, {@code %1$lu}</li>
 *   <li>{@code %[n$]@}, e.g. {@code %@}, {@code %2$@}</li>
 * </ul>
 * {@code %%} is a literal percent sign. Positional prefixes do not affect order or type:
 * parameters follow the order in which placeholders appear.
 */
public class FormatClassifier {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile(
            "%%"
                    + "|%(?:\\d+\\$)?[-+0#]*\\d*(?:\\.\\d+)?(?:ll|l|hh|h|q)?[diuf]"
                    + "|%(?:\\d+\\$)?@"
    );

    private static final String LITERAL_PERCENT = "%%";

    public List<InterpolationType> classify(String text) {
        List<InterpolationType> types = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return types;
        }

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();
            if (LITERAL_PERCENT.equals(token)) {
                continue;
            }
            types.add(InterpolationType.fromPlaceholder(token));
        }
        return types;
    }
}
