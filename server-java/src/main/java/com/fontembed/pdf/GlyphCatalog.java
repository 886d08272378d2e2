package com.fontembed.pdf;

import com.fontembed.font.FontHandle;
import com.fontembed.font.Glyph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Все глифы, достижимые из cmap шрифта, по возрастанию идентификатора и без повторов.
 * Порядок важен: по нему строятся массив /W и ToUnicode CMap.
 */
public final class GlyphCatalog {

    private static final Comparator<Glyph> BY_ASCENDING_ID = Comparator.comparingInt(Glyph::id);

    private final List<Glyph> glyphs;

    private GlyphCatalog(List<Glyph> glyphs) {
        this.glyphs = List.copyOf(glyphs);
    }

    public static GlyphCatalog of(FontHandle font) {
        List<Integer> characterSet = font.characterSet();
        List<Glyph> resolved = new ArrayList<>(characterSet.size());
        for (Integer codePoint : characterSet) {
            Glyph glyph = font.glyphForCodePoint(codePoint);
            if (glyph != null) {
                resolved.add(glyph);
            }
        }
        return fromGlyphs(resolved);
    }

    /**
     * Сортирует по id и оставляет первый глиф для каждого id. Сортировка устойчивая,
     * поэтому "первый" означает первый в порядке {@code source}.
     */
    public static GlyphCatalog fromGlyphs(Collection<Glyph> source) {
        List<Glyph> sorted = new ArrayList<>(source);
        sorted.sort(BY_ASCENDING_ID);
        List<Glyph> unique = new ArrayList<>(sorted.size());
        for (Glyph glyph : sorted) {
            if (unique.isEmpty() || unique.get(unique.size() - 1).id() != glyph.id()) {
                unique.add(glyph);
            }
        }
        return new GlyphCatalog(unique);
    }

    public List<Glyph> glyphs() {
        return glyphs;
    }

    public int size() {
        return glyphs.size();
    }

    public boolean isEmpty() {
        return glyphs.isEmpty();
    }
}
