package org.buildlens.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.buildlens.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader and ClientOptions.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("buildlens.client.format");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void load_shouldUseReferenceDefaults() {
        Config config = ConfigLoader.load(null);

        ClientOptions options = ClientOptions.fromConfig(config);
        assertEquals(ClientOptions.Format.JSON, options.format());
        assertFalse(options.prettyPrint());
        assertNull(options.displayName());
    }

    @Test
    @DisplayName("Explicit file overrides reference defaults")
    void load_explicitFileOverridesDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "buildlens.client.format = LOG\nbuildlens.target.display-name = \"app\"\n");

        ClientOptions options = ClientOptions.fromConfig(ConfigLoader.load(file.toFile()));

        assertEquals(ClientOptions.Format.LOG, options.format());
        assertEquals("app", options.displayName());
        assertFalse(options.prettyPrint());
    }

    @Test
    @DisplayName("System property overrides file configuration")
    void load_systemPropertyOverridesFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "buildlens.client.format = LOG\n");
        System.setProperty("buildlens.client.format", "JSON");
        ConfigFactory.invalidateCaches();

        ClientOptions options = ClientOptions.fromConfig(ConfigLoader.load(file.toFile()));

        assertEquals(ClientOptions.Format.JSON, options.format());
    }

    @Test
    void load_missingExplicitFileFails() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.load(new File("does-not-exist.conf")));
        assertTrue(e.getMessage().contains("does-not-exist.conf"));
    }

    @Test
    void fromConfig_readsClasspathFile() {
        ClientOptions options = ClientOptions.fromConfig(
                loadResource("org/buildlens/cli/config/test-config.conf"));

        assertEquals(ClientOptions.Format.LOG, options.format());
        assertTrue(options.prettyPrint());
        assertEquals("core", options.displayName());
    }

    @Test
    void fromConfig_unknownFormatIsRejected() {
        Config config = loadResource("org/buildlens/cli/config/bad-format.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ClientOptions.fromConfig(config));
        assertTrue(e.getMessage().contains("XML"));
    }

    @Test
    void fromConfig_emptyConfigUsesBuiltInDefaults() {
        ClientOptions options = ClientOptions.fromConfig(ConfigFactory.empty());

        assertEquals(ClientOptions.Format.JSON, options.format());
        assertFalse(options.prettyPrint());
    }

    @Test
    void format_parseIsCaseInsensitive() {
        assertEquals(ClientOptions.Format.LOG, ClientOptions.Format.parse(" log "));
    }

    private static Config loadResource(String resource) {
        return ConfigFactory.parseResources(resource)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
