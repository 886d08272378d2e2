package com.fontembed.font;

import java.util.List;

/**
 * Глиф шрифта: идентификатор, ширина продвижения (в единицах шрифта) и кодовые точки Unicode,
 * которые cmap шрифта отображает на этот глиф.
 */
public record Glyph(
        int id,
        double advanceWidth,
        List<Integer> codePoints
) {

    public Glyph {
        if (id < 0) {
            throw new IllegalArgumentException("glyph id must be non-negative: " + id);
        }
        codePoints = codePoints == null ? List.of() : List.copyOf(codePoints);
    }

    public Glyph withAdvanceWidth(double width) {
        return new Glyph(id, width, codePoints);
    }
}
