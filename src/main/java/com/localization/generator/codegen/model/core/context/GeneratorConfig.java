package com.localization.generator.codegen.model.core.context;

import java.nio.file.Path;
import java.util.List;

import com.localization.generator.codegen.util.NamingUtil;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for the accessor generator.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Table files, or directories to scan for tables.
     */
    @Singular
    private List<Path> inputs;

    /**
     * Locale whose {@code <locale>.lproj} strings and {@code _<locale>} properties are read.
     */
    @Builder.Default
    private String locale = "en";

    /**
     * Name of the generated top-level class.
     */
    @Builder.Default
    private String topLevelName = "Strings";

    /**
     * Package of the generated file; the default package when null or blank.
     */
    private String packageName;

    /**
     * Resource bundle base name the generated lookup helper reads from.
     */
    @Builder.Default
    private String bundleName = "Localizable";

    /**
     * Output file, or a source root directory receiving {@code <package path>/<TopLevelName>.java}.
     */
    private Path output;

    /**
     * Whether to overwrite an existing output file.
     */
    private boolean force;

    /**
     * Whether this is a dry run (no files written).
     */
    private boolean dryRun;

    public String getLookupClassName() {
        return NamingUtil.lookupClassName(topLevelName);
    }

    public boolean hasPackage() {
        return packageName != null && !packageName.isBlank();
    }
}
