package com.localization.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.localization.generator.codegen.model.core.context.GeneratorConfig;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class LocalizationGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void testOutputDirectoryIsSourceRoot() {
        GeneratorConfig config = GeneratorConfig.builder()
                .output(tempDir.resolve("src"))
                .packageName("com.example.app")
                .topLevelName("L10n")
                .build();

        assertThat(new LocalizationGenerator(config).resolveOutputFile())
                .isEqualTo(tempDir.resolve("src/com/example/app/L10n.java"));
    }

    @Test
    void testJavaFileOutputIsUsedAsIs() {
        GeneratorConfig config = GeneratorConfig.builder()
                .output(tempDir.resolve("gen/Texts.java"))
                .packageName("com.example.app")
                .build();

        assertThat(new LocalizationGenerator(config).resolveOutputFile())
                .isEqualTo(tempDir.resolve("gen/Texts.java"));
    }

    @Test
    void testDirectoryNamedLikeJavaFileIsSourceRoot() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("odd.java"));
        GeneratorConfig config = GeneratorConfig.builder().output(dir).build();

        assertThat(new LocalizationGenerator(config).resolveOutputFile()).isEqualTo(dir.resolve("Strings.java"));
    }

    @Test
    void testExistingOutputIsKeptWithoutForce() throws IOException {
        Path input = tempDir.resolve("Localizable.strings");
        Files.writeString(input, "\"title\" = \"Title\";");
        Path output = tempDir.resolve("Strings.java");
        Files.writeString(output, "// hand written");

        GeneratorResult result = new LocalizationGenerator(GeneratorConfig.builder()
                .input(input)
                .output(output)
                .build()).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("already exists").contains("--force");
        assertThat(Files.readString(output)).isEqualTo("// hand written");
    }

    @Test
    void testMalformedTableIsReportedWithPath() throws IOException {
        Path input = tempDir.resolve("Broken.strings");
        Files.writeString(input, "\"title\" = \"Title\"");

        GeneratorResult result = new LocalizationGenerator(GeneratorConfig.builder()
                .input(input)
                .output(tempDir)
                .build()).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailingPath()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(Files.exists(tempDir.resolve("Strings.java"))).isFalse();
    }
}
