package com.fontembed.model;

/**
 * Сводка по одному шрифту, найденному в ресурсах страницы PDF.
 */
public record EmbeddedFontInfo(
        String resourceName,
        String baseFont,
        String subtype,
        String encoding,
        String descendantSubtype,
        String cidOrdering,
        String fontFileKey,
        boolean hasToUnicode,
        int widthEntries
) {

    public boolean isComposite() {
        return "Type0".equals(subtype);
    }
}
