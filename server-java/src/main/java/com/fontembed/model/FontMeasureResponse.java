package com.fontembed.model;

import com.fontembed.font.FontKind;

public record FontMeasureResponse(
        String postscriptName,
        FontKind kind,
        int unitsPerEm,
        int glyphCount,
        String encodedText,
        double size,
        double width,
        double height,
        Double sizeForHeight
) {
}
