package org.cbqueue.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the queue configuration from layered sources.
 * The loader respects a specific precedence order so that deployments can override the
 * shipped defaults without touching the classpath.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Classpath resource read by {@link #load()}.
     */
    public static final String DEFAULT_CONFIG_RESOURCE = "cbqueue.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration from {@value #DEFAULT_CONFIG_RESOURCE}.
     *
     * @return The resolved configuration.
     * @see #load(String)
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_RESOURCE);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables (CONFIG_FORCE_ prefixed)
     * 2. Java System Properties (-Dkey=value)
     * 3. The given classpath resource
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param resourceName The classpath resource holding the application configuration.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String resourceName) {
        // Only CONFIG_FORCE_-prefixed variables are mapped, '_' becomes '.':
        // CONFIG_FORCE_cbqueue_queues_events_timeout=2s sets cbqueue.queues.events.timeout
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();

        final Config systemConfig = ConfigFactory.systemProperties();

        final Config fileConfig = ConfigFactory.parseResources(resourceName);
        if (fileConfig.isEmpty()) {
            LOG.info("Configuration resource '{}' not found or empty, using defaults.", resourceName);
        } else {
            LOG.debug("Loaded configuration resource '{}'", resourceName);
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(systemConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
