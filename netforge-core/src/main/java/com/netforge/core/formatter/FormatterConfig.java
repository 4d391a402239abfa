package com.netforge.core.formatter;

import com.netforge.core.config.SpiceConfig;

import java.util.Map;

/**
 * Configuration for netlist formatting.
 *
 * @param customSettings formatter-specific settings, keyed "&lt;formatter&gt;.&lt;name&gt;"
 */
public record FormatterConfig(
    Map<String, Object> customSettings
) {
    /**
     * Compact constructor with validation.
     */
    public FormatterConfig {
        customSettings = customSettings == null ? Map.of() : Map.copyOf(customSettings);
    }

    /**
     * Creates a default configuration.
     *
     * @return default formatter config
     */
    public static FormatterConfig defaults() {
        return new FormatterConfig(Map.of());
    }

    /**
     * Creates a configuration carrying SPICE settings.
     *
     * @param spice SPICE settings
     * @return formatter config
     */
    public static FormatterConfig of(SpiceConfig spice) {
        return new FormatterConfig(spice == null ? Map.of() : spice.toSettings());
    }

    /**
     * Gets a custom setting value.
     *
     * @param key setting key
     * @param <T> expected type
     * @return setting value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key) {
        return (T) customSettings.get(key);
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
