package org.pokeai.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.pokeai.junit.extensions.logging.LogWatchExtension;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String TURN_PROPERTY = "pokeai.battle.max-turns";

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty(TURN_PROPERTY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void load_withoutFile_shouldUseReferenceDefaults() {
        // When
        final Config config = ConfigLoader.load(null);

        // Then
        assertEquals(200, config.getInt("pokeai.battle.max-turns"));
        assertEquals(42L, config.getLong("pokeai.battle.seed"));
        assertEquals("data", config.getString("pokeai.rule-tables.path"));
        assertTrue(config.getStringList("pokeai.format.banned-items").contains("quickclaw"));
    }

    @Test
    void load_withExplicitFile_shouldOverrideDefaults() throws IOException {
        // Given
        final Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, """
            pokeai {
              battle.max-turns = 25
              format.tera-allowed = false
            }
            """);

        // When
        final Config config = ConfigLoader.load(file.toFile());

        // Then
        assertEquals(25, config.getInt("pokeai.battle.max-turns"));
        assertEquals(false, config.getBoolean("pokeai.format.tera-allowed"));
        assertEquals(42L, config.getLong("pokeai.battle.seed"), "keys absent from the file fall back to defaults");
    }

    @Test
    void load_withMissingExplicitFile_shouldThrow() {
        final File missing = tempDir.resolve("nope.conf").toFile();

        final IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("nope.conf"));
    }

    @Test
    void load_systemPropertyShouldWinOverFile() throws IOException {
        // Given
        final Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "pokeai.battle.max-turns = 25\n");
        System.setProperty(TURN_PROPERTY, "7");
        ConfigFactory.invalidateCaches();

        // When
        final Config config = ConfigLoader.load(file.toFile());

        // Then
        assertEquals(7, config.getInt("pokeai.battle.max-turns"));
    }
}
