package com.fontembed.font;

/**
 * Габаритный прямоугольник всех глифов в единицах шрифта.
 */
public record FontBBox(
        double minX,
        double minY,
        double maxX,
        double maxY
) {
}
