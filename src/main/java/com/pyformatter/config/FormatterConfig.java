package com.pyformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.Preview;
import com.pyformatter.api.TargetVersion;

/**
 * Configuration for the formatter: the {@code general} section holds the formatting options,
 * the {@code cache} section the result cache settings.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Object> cacheConfig;

    public FormatterConfig(Map<String, Object> generalConfig, Map<String, Object> cacheConfig) {
        this.generalConfig = generalConfig;
        this.cacheConfig = cacheConfig;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    public Map<String, Object> getCacheConfigMap() {
        return new HashMap<>(cacheConfig);
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getCacheConfig(String key, T defaultValue) {
        return coerce(cacheConfig.get(key), defaultValue);
    }

    @SuppressWarnings("unchecked")
    private static <T> T coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }
            return defaultValue;
        }
        return (T) value;
    }

    /**
     * Builds the formatting options described by the general section.
     *
     * @throws IllegalArgumentException when a target version or preview feature is unknown
     */
    public FormatOptions toFormatOptions() {
        FormatOptions.Builder builder = FormatOptions.builder()
                .lineLength(getGeneralConfig("lineLength", FormatOptions.DEFAULT_LINE_LENGTH))
                .pyi(getGeneralConfig("pyi", false))
                .skipStringNormalization(getGeneralConfig("skipStringNormalization", false))
                .skipMagicTrailingComma(getGeneralConfig("skipMagicTrailingComma", false))
                .fast(getGeneralConfig("fast", false))
                .diff(getGeneralConfig("diff", false));
        for (String version : stringList("targetVersions")) {
            builder.addTargetVersion(TargetVersion.parse(version));
        }
        for (String feature : stringList("preview")) {
            builder.addPreviewFeature(Preview.valueOf(feature.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
        }
        return builder.build();
    }

    private List<String> stringList(String key) {
        List<String> result = new ArrayList<>();
        Object value = generalConfig.get(key);
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(String.valueOf(item));
            }
        } else if (value instanceof String && !((String) value).isBlank()) {
            for (String item : ((String) value).split(",")) {
                result.add(item.trim());
            }
        }
        return result;
    }
}
