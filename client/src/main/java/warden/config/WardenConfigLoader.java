package warden.config;

import java.util.Map;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;

/**
 * Builds {@link WardenConfig} outside a CDI container.
 *
 * <p>Sources, highest ordinal first: explicit overrides, system properties,
 * environment variables, {@code META-INF/microprofile-config.properties}.
 */
public final class WardenConfigLoader {

    private static final int OVERRIDE_ORDINAL = 500;

    private WardenConfigLoader() {}

    public static WardenConfig load() {
        return load(Map.of());
    }

    /**
     * Load configuration with {@code overrides} taking precedence over every
     * other source.
     *
     * @param overrides property names and values, e.g. {@code warden.lock.timeout=PT5S}
     * @return configuration mapping
     */
    public static WardenConfig load(Map<String, String> overrides) {
        final var config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDiscoveredConverters()
                .withSources(new PropertiesConfigSource(overrides, "warden-overrides", OVERRIDE_ORDINAL))
                .withMapping(WardenConfig.class)
                .build();
        return config.getConfigMapping(WardenConfig.class);
    }
}
