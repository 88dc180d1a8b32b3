package com.meshsentinel.monitor.output;

import java.util.Locale;

/**
 * Closed set of output formats, each backed by one {@link AnomalyRenderer}.
 *
 * @since 1.0.0
 */
public enum OutputFormat {

    TEXT,
    TABLE,
    JSON;

    /**
     * @param name format name as written in configuration, case-insensitive
     * @throws IllegalArgumentException if no format has this name
     */
    public static OutputFormat fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (OutputFormat format : values()) {
                if (format.name().equals(normalized)) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unknown output format: '" + name + "'");
    }

    /**
     * @return a new renderer for this format
     */
    public AnomalyRenderer newRenderer() {
        return switch (this) {
            case TEXT -> new TextRenderer();
            case TABLE -> new TableRenderer();
            case JSON -> new JsonRenderer();
        };
    }
}
