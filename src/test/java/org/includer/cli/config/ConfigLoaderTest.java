package org.includer.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("test.nested.setting");
        System.clearProperty("merge.charset");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertTrue(config.getBoolean("merge.comment-aware"));
        assertEquals("UTF-8", config.getString("merge.charset"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("test.nested.setting", "system-nested");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("system-nested", config.getString("test.nested.setting"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @DisplayName("loadDefaults should expose the reference merge settings")
    void loadDefaults_shouldExposeReferenceSettings() {
        Config config = ConfigLoader.loadDefaults();

        assertFalse(config.getBoolean("merge.comment-aware"));
        assertTrue(config.getStringList("merge.extensions").contains(".frag"));
        assertEquals("PLAIN", config.getString("logging.format"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("System property should override reference defaults")
    void loadDefaults_systemPropertyShouldOverrideReference() {
        System.setProperty("merge.charset", "ISO-8859-1");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadDefaults();

        assertEquals("ISO-8859-1", config.getString("merge.charset"));
    }

    @Test
    @DisplayName("Should resolve configuration references correctly")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
    }

    @Test
    @DisplayName("resolve should prefer an explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                messages::add);

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("resolve should reject an explicit file that does not exist")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/includer.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, message -> { }));

        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    @DisplayName("resolve should honor -Dconfig.file and reject a missing one")
    void resolve_shouldUseConfigFileProperty() {
        List<String> messages = new ArrayList<>();
        System.setProperty("config.file", testResource("test-config.conf").getPath());
        try {
            Config config = ConfigLoader.resolve(null, messages::add);

            assertEquals("file-value", config.getString("test.value"));
            assertTrue(messages.get(0).startsWith("Using configuration file specified via -Dconfig.file"));

            System.setProperty("config.file", "does-not-exist/includer.conf");
            assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(null, message -> { }));
        } finally {
            System.clearProperty("config.file");
        }
    }

    @Test
    @DisplayName("resolve should fall back to reference defaults without any config file")
    void resolve_shouldFallBackToDefaults() {
        assumeFalse(ConfigLoader.WORKING_DIR_CONFIG.exists());
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, messages::add);

        assertFalse(config.getBoolean("merge.comment-aware"));
        assertTrue(messages.get(0).startsWith("No 'config"));
    }

    /**
     * Locates a test resource file on the classpath.
     *
     * @param name the resource file name (relative to this test class's package).
     * @return the {@link File} pointing to the test resource.
     */
    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
