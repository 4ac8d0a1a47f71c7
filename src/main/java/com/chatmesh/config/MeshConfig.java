package com.chatmesh.config;

import com.chatmesh.ice.IceConfigurationProvider;
import com.chatmesh.ice.StaticIceConfigurationProvider;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings shared by every connection of a mesh session.
 *
 * {@link #load()} reads {@value #RESOURCE} from the classpath and lets JVM system properties of
 * the same name override it.
 */
public final class MeshConfig {

    private static final Logger LOGGER = Logger.getLogger(MeshConfig.class.getName());

    public static final String RESOURCE = "chatmesh.properties";
    public static final String GRACE_PERIOD_KEY = "mesh.disconnect-grace-ms";
    public static final String MAX_ICE_RESTARTS_KEY = "mesh.ice-restart.max-attempts";

    static final long DEFAULT_GRACE_PERIOD_MS = 5_000;
    static final int DEFAULT_MAX_ICE_RESTARTS = -1;

    private final Duration disconnectGracePeriod;
    private final int maxIceRestarts;
    private final IceConfigurationProvider iceConfiguration;

    public MeshConfig(Duration disconnectGracePeriod, int maxIceRestarts,
                      IceConfigurationProvider iceConfiguration) {
        this.disconnectGracePeriod = Objects.requireNonNull(disconnectGracePeriod, "disconnectGracePeriod");
        if (disconnectGracePeriod.isNegative()) {
            throw new IllegalArgumentException("Grace period must not be negative: " + disconnectGracePeriod);
        }
        if (maxIceRestarts < -1) {
            throw new IllegalArgumentException("maxIceRestarts must be -1 (unlimited) or >= 0: " + maxIceRestarts);
        }
        this.maxIceRestarts = maxIceRestarts;
        this.iceConfiguration = Objects.requireNonNull(iceConfiguration, "iceConfiguration");
    }

    public static MeshConfig defaults() {
        return new MeshConfig(Duration.ofMillis(DEFAULT_GRACE_PERIOD_MS), DEFAULT_MAX_ICE_RESTARTS,
            StaticIceConfigurationProvider.defaults());
    }

    public static MeshConfig load() {
        Properties properties = new Properties();
        try (InputStream in = MeshConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOGGER.fine("[MeshConfig] " + RESOURCE + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("mesh.") || name.startsWith("ice.")) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    public static MeshConfig fromProperties(Properties properties) {
        long graceMs = parseLong(properties, GRACE_PERIOD_KEY, DEFAULT_GRACE_PERIOD_MS);
        int maxRestarts = parseInt(properties, MAX_ICE_RESTARTS_KEY, DEFAULT_MAX_ICE_RESTARTS);
        MeshConfig config = new MeshConfig(Duration.ofMillis(graceMs), maxRestarts,
            StaticIceConfigurationProvider.fromProperties(properties));
        LOGGER.info("[MeshConfig] Loaded " + config);
        return config;
    }

    private static long parseLong(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static int parseInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public MeshConfig withDisconnectGracePeriod(Duration gracePeriod) {
        return new MeshConfig(gracePeriod, maxIceRestarts, iceConfiguration);
    }

    public MeshConfig withMaxIceRestarts(int maxRestarts) {
        return new MeshConfig(disconnectGracePeriod, maxRestarts, iceConfiguration);
    }

    public Duration getDisconnectGracePeriod() {
        return disconnectGracePeriod;
    }

    /**
     * Consecutive ICE restarts allowed before a failure escalates to teardown; -1 for no cap.
     */
    public int getMaxIceRestarts() {
        return maxIceRestarts;
    }

    public IceConfigurationProvider getIceConfiguration() {
        return iceConfiguration;
    }

    @Override
    public String toString() {
        return String.format("MeshConfig[grace=%dms, maxIceRestarts=%d, ice=%s]",
            disconnectGracePeriod.toMillis(), maxIceRestarts, iceConfiguration.getIceServers());
    }
}
