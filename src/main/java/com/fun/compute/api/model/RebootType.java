package com.fun.compute.api.model;

import java.util.Locale;
import java.util.Optional;

public enum RebootType {
    HARD,
    SOFT;

    public static Optional<RebootType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        for (RebootType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
