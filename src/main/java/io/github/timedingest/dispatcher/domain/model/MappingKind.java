package io.github.timedingest.dispatcher.domain.model;

import java.util.Locale;

public enum MappingKind {
    JSON, CSV, AVRO;

    public static boolean isKnown(String configured) {
        if (configured == null) {
            return false;
        }
        String normalized = configured.trim().toUpperCase(Locale.ROOT);
        for (MappingKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Unrecognized and missing values fall back to {@link #JSON}.
     */
    public static MappingKind resolve(String configured) {
        if (!isKnown(configured)) {
            return JSON;
        }
        return valueOf(configured.trim().toUpperCase(Locale.ROOT));
    }
}
