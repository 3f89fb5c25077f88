package com.vidnyan.semtree.domain.model;

import java.util.Locale;

/**
 * Configuration formats built with both an {@code ast} and a {@code data} branch.
 */
public enum ConfigFormat {
    JSON,
    YAML;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConfigFormat fromTag(String tag) {
        for (ConfigFormat format : values()) {
            if (format.tag().equalsIgnoreCase(tag)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown configuration format: " + tag);
    }
}
