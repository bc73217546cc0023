package org.pycregistry.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RegistryConfig}: shipped defaults, system property overrides and
 * explicit configuration blocks.
 */
@Tag("unit")
class RegistryConfigTest {

    private static final String FALLBACK_KEY = "pyc-registry.canonicalizer.cross-implementation-fallback";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(FALLBACK_KEY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("load should read the shipped reference defaults")
    void load_shouldReadReferenceDefaults() {
        RegistryConfig config = RegistryConfig.load();

        assertEquals(List.of("pypy", "dropbox", "Jython", "Pyston", "Graal"), config.variantSuffixes());
        assertFalse(config.crossImplementationFallback());
        assertEquals(Optional.of("pypy"), config.suffixFor("PyPy"));
        assertEquals(Optional.of("Graal"), config.suffixFor("GraalVM"));
    }

    @Test
    @DisplayName("System property should override the reference default")
    void load_systemPropertyShouldOverrideDefault() {
        System.setProperty(FALLBACK_KEY, "true");
        ConfigFactory.invalidateCaches();

        RegistryConfig config = RegistryConfig.load();

        assertTrue(config.crossImplementationFallback());
        assertEquals(List.of("pypy", "dropbox", "Jython", "Pyston", "Graal"), config.variantSuffixes());
    }

    @Test
    @DisplayName("fromConfig should read an explicit block")
    void fromConfig_shouldReadExplicitBlock() {
        Config raw = ConfigFactory.parseResources("custom-registry.conf").resolve();

        RegistryConfig config = RegistryConfig.fromConfig(raw.getConfig(RegistryConfig.ROOT));

        assertEquals(List.of("pypy"), config.variantSuffixes());
        assertTrue(config.crossImplementationFallback());
        assertEquals(Map.of("PyPy", "pypy"), config.implementationSuffixes());
    }

    @Test
    @DisplayName("fromConfig should fail on a missing key")
    void fromConfig_shouldFailOnMissingKey() {
        Config incomplete = ConfigFactory.parseString("canonicalizer.variant-suffixes = [pypy]");

        assertThrows(ConfigException.Missing.class, () -> RegistryConfig.fromConfig(incomplete));
    }

    @Test
    @DisplayName("CPython and unnamed runtimes get no suffix")
    void suffixFor_shouldBeEmptyForPlainRuntimes() {
        RegistryConfig config = RegistryConfig.load();

        assertTrue(config.suffixFor("CPython").isEmpty());
        assertTrue(config.suffixFor(null).isEmpty());
    }

    @Test
    @DisplayName("Settings are copied defensively")
    void constructor_shouldCopyCollections() {
        List<String> suffixes = new java.util.ArrayList<>(List.of("pypy"));
        RegistryConfig config = new RegistryConfig(suffixes, false, Map.of());

        suffixes.add("other");

        assertEquals(List.of("pypy"), config.variantSuffixes());
        assertThrows(UnsupportedOperationException.class, () -> config.variantSuffixes().add("x"));
    }
}
