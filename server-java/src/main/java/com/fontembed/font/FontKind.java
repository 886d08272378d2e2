package com.fontembed.font;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Тип контуров в шрифтовой программе: CFF (OpenType/PostScript) или TrueType.
 */
public enum FontKind {
    CFF("cff"),
    TRUE_TYPE("truetype");

    private final String id;

    FontKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public boolean isCff() {
        return this == CFF;
    }
}
