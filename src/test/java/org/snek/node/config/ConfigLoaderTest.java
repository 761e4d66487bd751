package org.snek.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. Environment Variables (highest priority)
 * 2. System Properties
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        // Invalidate the cache before each test to ensure a clean slate
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("snek.grid.width");
        System.clearProperty("snek.timing.move-interval");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference defaults when the file is missing")
    void load_shouldUseDefaultsWhenFileMissing() {
        Config config = ConfigLoader.load(new File(tempDir.toFile(), "missing.conf"));

        assertEquals(19, config.getInt("snek.grid.width"));
        assertEquals(15, config.getInt("snek.grid.height"));
        assertEquals(0.25, config.getDouble("snek.timing.move-interval"));
        assertEquals(5.0, config.getDouble("snek.timing.spawn-interval"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("File configuration should override reference defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        Path file = tempDir.resolve("snek.conf");
        Files.writeString(file, "snek.grid.height = 7\nsnek.seed = 1234\n");

        Config config = ConfigLoader.load(file.toFile());

        assertEquals(7, config.getInt("snek.grid.height"));
        assertEquals(1234L, config.getLong("snek.seed"));
        assertEquals(19, config.getInt("snek.grid.width"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() throws IOException {
        Path file = tempDir.resolve("snek.conf");
        Files.writeString(file, "snek.grid.width = 11\nsnek.timing.move-interval = 0.5\n");
        System.setProperty("snek.grid.width", "25");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file.toFile());

        assertEquals(25, config.getInt("snek.grid.width"));
        assertEquals(0.5, config.getDouble("snek.timing.move-interval"));
    }

    @Test
    @DisplayName("A directory in place of the file is skipped")
    void load_directoryIsSkipped() {
        Config config = ConfigLoader.load(tempDir.toFile());

        assertEquals(19, config.getInt("snek.grid.width"));
    }
}
