package org.llfront.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.llfront.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties
 * 2. Configuration File
 * 3. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String DEPTH_KEY = "llfront.parser.max-nesting-depth";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(DEPTH_KEY);
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when the file does not exist")
    void load_shouldUseDefaultsWithoutFile() {
        // Act
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        // Assert
        assertThat(ParserOptions.fromConfig(config)).isEqualTo(ParserOptions.DEFAULT);
    }

    @Test
    @DisplayName("Configuration file should override the defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = writeConfig("llfront.parser { max-nesting-depth = 32 }\n");

        // Act
        ParserOptions options = ParserOptions.fromConfig(ConfigLoader.load(file));

        // Assert
        assertThat(options.maxNestingDepth()).isEqualTo(32);
        assertThat(options.sourceName()).isEqualTo("<memory>"); // default kept
    }

    @Test
    @DisplayName("System property should override the defaults")
    void load_systemPropertyShouldOverrideDefaults() {
        // Arrange
        System.setProperty(DEPTH_KEY, "12");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        // Assert
        assertThat(config.getInt(DEPTH_KEY)).isEqualTo(12);
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() throws IOException {
        // Arrange
        File file = writeConfig("llfront.parser {\n  max-nesting-depth = 32\n  source-name = \"file.ll\"\n}\n");
        System.setProperty(DEPTH_KEY, "8");
        ConfigFactory.invalidateCaches();

        // Act
        ParserOptions options = ParserOptions.fromConfig(ConfigLoader.load(file));

        // Assert
        assertThat(options.maxNestingDepth()).isEqualTo(8);
        assertThat(options.sourceName()).isEqualTo("file.ll");
    }

    @Test
    @DisplayName("Should resolve substitutions across sources")
    void load_shouldResolveSubstitutions() throws IOException {
        // Arrange
        File file = writeConfig("base-depth = 40\nllfront.parser.max-nesting-depth = ${base-depth}\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertThat(config.getInt(DEPTH_KEY)).isEqualTo(40);
    }
}
