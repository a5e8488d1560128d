package com.pyformatter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.Preview;
import com.pyformatter.api.TargetVersion;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("pyformatter.yml");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void defaultConfigurationGivesDefaultOptions() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        FormatOptions options = config.toFormatOptions();
        assertEquals(FormatOptions.DEFAULT_LINE_LENGTH, options.getLineLength());
        assertTrue(options.getTargetVersions().isEmpty());
        assertFalse(options.isFast());
        assertTrue(config.getCacheConfig("enabled", false));
    }

    @Test
    void missingFileFallsBackToDefaults() {
        FormatterConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml"));
        assertEquals(88, (int) config.getGeneralConfig("lineLength", 0));
        assertEquals(88, ConfigurationLoader.loadConfig(null).toFormatOptions().getLineLength());
    }

    @Test
    void valuesFromFile() throws IOException {
        Path file = write("general:\n"
                + "  lineLength: 100\n"
                + "  targetVersions: [py38, \"3.9\"]\n"
                + "  skipStringNormalization: true\n"
                + "  preview: [remove_redundant_guard_parens]\n"
                + "cache:\n"
                + "  enabled: false\n");
        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        FormatOptions options = config.toFormatOptions();
        assertEquals(100, options.getLineLength());
        assertEquals(EnumSet.of(TargetVersion.PY38, TargetVersion.PY39), options.getTargetVersions());
        assertTrue(options.isSkipStringNormalization());
        assertEquals(EnumSet.of(Preview.REMOVE_REDUNDANT_GUARD_PARENS), options.getPreviewFeatures());
        assertFalse(config.getCacheConfig("enabled", true));
    }

    @Test
    void outOfRangeLineLengthFallsBackToDefault() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadConfig(write("general:\n  lineLength: 5000\n"));
        assertEquals(FormatOptions.DEFAULT_LINE_LENGTH, config.toFormatOptions().getLineLength());
    }

    @Test
    void malformedFileFallsBackToDefaults() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadConfig(write("general: [unclosed\n"));
        assertEquals(FormatOptions.DEFAULT_LINE_LENGTH, config.toFormatOptions().getLineLength());
    }

    @Test
    void unknownTargetVersionIsRejected() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadConfig(write("general:\n  targetVersions: [py99]\n"));
        assertThrows(IllegalArgumentException.class, config::toFormatOptions);
    }

    @Test
    void savedConfigurationLoadsBack() throws IOException {
        Path file = write("general:\n  lineLength: 72\n  pyi: true\n");
        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        Path saved = tempDir.resolve("out/saved.yml");
        ConfigurationLoader.saveConfig(config, saved);
        FormatOptions options = ConfigurationLoader.loadConfig(saved).toFormatOptions();
        assertEquals(72, options.getLineLength());
        assertTrue(options.isPyi());
    }
}
