package org.difficient.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Loads the HOCON configuration that tunes differs and the patch engine.
 * <p>
 * Sources are composed with the following precedence (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Ddifficient.patch.fail-fast=true})</li>
 *   <li>Environment variables (as exposed by Typesafe Config)</li>
 *   <li>An optional user configuration file</li>
 *   <li>Library defaults ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Substitutions are resolved only after all layers are composed, so a user override of a
 * referenced value reaches every place that refers to it.
 *
 * @see DiffOptions#fromConfig(Config)
 */
public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     *
     * @param configFile the configuration file to load (must exist)
     * @return the fully resolved {@link Config}
     * @throws IllegalArgumentException if the file does not exist
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved
     */
    public static Config loadFromFile(final File configFile) {
        if (configFile == null || !configFile.exists()) {
            throw new IllegalArgumentException("Configuration file not found: "
                    + (configFile == null ? "null" : configFile.getAbsolutePath()));
        }
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only (no user file).
     *
     * @return the fully resolved {@link Config}
     */
    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
