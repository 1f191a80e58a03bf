package com.localization.generator.codegen;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.codegen.discovery.ResourceDiscoveryService;
import com.localization.generator.codegen.exception.MalformedTableException;
import com.localization.generator.codegen.model.core.context.GeneratorConfig;
import com.localization.generator.codegen.model.output.LocalizationSource;
import com.localization.generator.codegen.render.SourceFileRenderer;
import com.localization.generator.codegen.util.FileWriteUtil;

/**
 * Main generator: discovers tables, builds the accessor source and writes it.
 */
public class LocalizationGenerator {
    private static final Logger log = LoggerFactory.getLogger(LocalizationGenerator.class);

    private static final String JAVA_EXTENSION = ".java";

    private final GeneratorConfig config;
    private final ResourceDiscoveryService discoveryService;
    private final LocalizationSourceBuilder sourceBuilder;
    private final SourceFileRenderer fileRenderer;

    public LocalizationGenerator(GeneratorConfig config) {
        this(config, new ResourceDiscoveryService(), new LocalizationSourceBuilder(), new SourceFileRenderer());
    }

    public LocalizationGenerator(GeneratorConfig config,
                                 ResourceDiscoveryService discoveryService,
                                 LocalizationSourceBuilder sourceBuilder,
                                 SourceFileRenderer fileRenderer) {
        this.config = config;
        this.discoveryService = discoveryService;
        this.sourceBuilder = sourceBuilder;
        this.fileRenderer = fileRenderer;
    }

    /**
     * Generate the accessor source file.
     */
    public GeneratorResult generate() {
        try {
            log.info("Starting accessor generation...");

            // Step 1: Discover tables
            log.info("Step 1: Discovering localization tables...");
            List<Path> tablePaths = discoveryService.discoverTableFiles(config.getInputs(), config.getLocale());
            log.info("  Found {} table(s) for locale '{}'", tablePaths.size(), config.getLocale());

            // Step 2: Build accessor tree
            log.info("Step 2: Building accessor tree...");
            Optional<LocalizationSource> built = sourceBuilder.assemble(tablePaths, config.getTopLevelName());
            if (built.isEmpty()) {
                log.info("Nothing to generate");
                return GeneratorResult.nothingToGenerate();
            }
            LocalizationSource source = built.get();

            // Step 3: Render compilation unit
            log.info("Step 3: Rendering {}...", config.getTopLevelName() + JAVA_EXTENSION);
            String content = fileRenderer.render(config, source.getDeclarations());

            // Step 4: Write output
            Path outputFile = resolveOutputFile();
            boolean written = false;
            if (config.isDryRun()) {
                log.info("Step 4: Dry run, skipping write of {}", outputFile);
            } else {
                log.info("Step 4: Writing {}...", outputFile);
                if (Files.exists(outputFile) && !config.isForce()) {
                    return GeneratorResult.failure(
                            "Output file already exists: " + outputFile + ". Use --force to overwrite.");
                }
                written = FileWriteUtil.writeIfChanged(outputFile, content);
                if (!written) {
                    log.info("  {} is up to date", outputFile.getFileName());
                }
            }

            log.info("Accessor generation complete!");

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(outputFile)
                    .written(written)
                    .source(content)
                    .stats(source.getStats())
                    .build();

        } catch (MalformedTableException e) {
            log.error("Generation failed: {}", e.getMessage());
            return GeneratorResult.tableFailure(e.getPath(), e.getMessage());
        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    /**
     * A path ending in {@code .java} is the output file; anything else is a source root
     * that receives {@code <package path>/<TopLevelName>.java}.
     */
    Path resolveOutputFile() {
        Path output = config.getOutput() != null ? config.getOutput() : Path.of(".");
        output = output.toAbsolutePath().normalize();

        Path fileName = output.getFileName();
        if (fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(JAVA_EXTENSION)
                && !Files.isDirectory(output)) {
            return output;
        }

        Path dir = output;
        if (config.hasPackage()) {
            dir = dir.resolve(config.getPackageName().trim().replace('.', '/'));
        }
        return dir.resolve(config.getTopLevelName() + JAVA_EXTENSION);
    }
}
