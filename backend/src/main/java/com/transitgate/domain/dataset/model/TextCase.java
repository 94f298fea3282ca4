package com.transitgate.domain.dataset.model;

import java.util.Locale;

public enum TextCase {
    NONE,
    UPPER,
    LOWER;

    public String apply(String value) {
        return switch (this) {
            case NONE -> value;
            case UPPER -> value.toUpperCase(Locale.ROOT);
            case LOWER -> value.toLowerCase(Locale.ROOT);
        };
    }
}
