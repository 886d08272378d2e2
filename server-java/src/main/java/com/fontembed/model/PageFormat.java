package com.fontembed.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PageFormat {
    A4("a4"),
    A5("a5"),
    LETTER("letter"),
    /**
     * Страница по размеру измеренного текста плюс поля.
     */
    FIT("fit");

    private final String id;

    PageFormat(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static PageFormat from(String value) {
        if (value == null || value.isBlank()) {
            return A4;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PageFormat option : values()) {
            if (option.id.equals(normalized)) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unsupported page format: " + value);
    }
}
