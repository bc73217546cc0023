package org.pycregistry.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settings that tune version resolution, read from the {@code pyc-registry} block.
 * <p>
 * Composition follows the usual precedence (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>{@code application.conf} on the classpath</li>
 *   <li>{@code reference.conf} shipped with this library</li>
 * </ol>
 *
 * @param variantSuffixes             implementation suffixes stripped before structural matching
 * @param crossImplementationFallback whether a suffixed version may fall back to the plain version
 * @param implementationSuffixes      implementation name to catalog version suffix
 */
public record RegistryConfig(List<String> variantSuffixes,
                             boolean crossImplementationFallback,
                             Map<String, String> implementationSuffixes) {

    /** Root path of this library's settings. */
    public static final String ROOT = "pyc-registry";

    public RegistryConfig {
        variantSuffixes = List.copyOf(variantSuffixes);
        implementationSuffixes = Map.copyOf(implementationSuffixes);
    }

    /**
     * Loads the settings from system properties layered over the classpath configuration.
     *
     * @return the resolved settings.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or a key is missing.
     */
    public static RegistryConfig load() {
        Config config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.load())
                .resolve();
        return fromConfig(config.getConfig(ROOT));
    }

    /**
     * Reads the settings from an already resolved {@code pyc-registry} block.
     *
     * @param config the {@code pyc-registry} block.
     * @return the settings.
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type.
     */
    public static RegistryConfig fromConfig(Config config) {
        List<String> suffixes = config.getStringList("canonicalizer.variant-suffixes");
        boolean fallback = config.getBoolean("canonicalizer.cross-implementation-fallback");

        Map<String, String> implementations = new LinkedHashMap<>();
        Config implConfig = config.getConfig("runtime.implementation-suffixes");
        for (Map.Entry<String, ConfigValue> entry : implConfig.root().entrySet()) {
            implementations.put(entry.getKey(), entry.getValue().unwrapped().toString());
        }
        return new RegistryConfig(suffixes, fallback, implementations);
    }

    /**
     * Returns the catalog suffix for an implementation name.
     *
     * @param implementationName the name reported by the runtime probe, may be {@code null}.
     * @return the suffix, or empty for implementations that use plain version strings.
     */
    public Optional<String> suffixFor(String implementationName) {
        if (implementationName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(implementationSuffixes.get(implementationName));
    }
}
