package com.fontembed.pdf;

import java.util.Locale;
import java.util.Random;

public final class FontEmbeddingUtil {

    private static final String DEFAULT_FONT_NAME = "Font";
    private static final int SUFFIX_BOUND = 10_000;

    private FontEmbeddingUtil() {
    }

    /**
     * Добавляет к имени шрифта {@code -NNNN}. Просмотрщики различают встроенные шрифты
     * по BaseFont, поэтому два встраивания одной программы не должны совпадать по имени.
     */
    public static String addRandomSuffix(String prefix, Random random) {
        String base = prefix != null && !prefix.isBlank() ? prefix.trim() : DEFAULT_FONT_NAME;
        return base + "-" + random.nextInt(SUFFIX_BOUND);
    }

    public static String toHexStringOfMinLength(int value, int minLength) {
        StringBuilder hex = new StringBuilder(Integer.toHexString(value).toLowerCase(Locale.ROOT));
        while (hex.length() < minLength) {
            hex.insert(0, '0');
        }
        return hex.toString();
    }

    /**
     * Кодовые единицы UTF-16BE в hex; вне BMP получается суррогатная пара.
     */
    public static String toUtf16Hex(int codePoint) {
        StringBuilder hex = new StringBuilder(8);
        for (char unit : Character.toChars(codePoint)) {
            hex.append(toHexStringOfMinLength(unit, 4));
        }
        return hex.toString();
    }
}
