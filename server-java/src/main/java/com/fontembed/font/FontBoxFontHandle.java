package com.fontembed.font;

import org.apache.fontbox.ttf.CmapLookup;
import org.apache.fontbox.ttf.HeaderTable;
import org.apache.fontbox.ttf.HorizontalHeaderTable;
import org.apache.fontbox.ttf.KerningSubtable;
import org.apache.fontbox.ttf.KerningTable;
import org.apache.fontbox.ttf.OS2WindowsMetricsTable;
import org.apache.fontbox.ttf.OpenTypeFont;
import org.apache.fontbox.ttf.PostScriptTable;
import org.apache.fontbox.ttf.TrueTypeFont;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link FontHandle} поверх FontBox. Все таблицы читаются один раз при загрузке,
 * после этого исходный {@link TrueTypeFont} больше не нужен.
 */
final class FontBoxFontHandle implements FontHandle {

    private static final int MAC_STYLE_ITALIC = 0x02;
    private static final int NOTDEF_GLYPH_ID = 0;

    private final String postscriptName;
    private final int unitsPerEm;
    private final double ascent;
    private final double descent;
    private final double capHeight;
    private final double xHeight;
    private final FontBBox bbox;
    private final double italicAngle;
    private final FontKind kind;
    private final boolean fixedPitch;
    private final int familyClass;
    private final boolean italic;
    private final Glyph[] glyphs;
    private final Map<Integer, Integer> glyphIdByCodePoint;
    private final List<Integer> characterSet;
    private final KerningSubtable kerning;

    private FontBoxFontHandle(TrueTypeFont font) throws IOException {
        HeaderTable head = font.getHeader();
        HorizontalHeaderTable hhea = font.getHorizontalHeader();
        PostScriptTable post = font.getPostScript();
        OS2WindowsMetricsTable os2 = font.getOS2Windows();

        this.postscriptName = font.getName();
        this.unitsPerEm = font.getUnitsPerEm();
        this.ascent = hhea.getAscender();
        this.descent = hhea.getDescender();
        this.bbox = new FontBBox(head.getXMin(), head.getYMin(), head.getXMax(), head.getYMax());
        this.italic = (head.getMacStyle() & MAC_STYLE_ITALIC) != 0;
        this.italicAngle = post != null ? post.getItalicAngle() : 0;
        this.fixedPitch = post != null && post.getIsFixedPitch() != 0;
        if (os2 != null) {
            this.familyClass = (os2.getFamilyClass() >> 8) & 0xFF;
            this.capHeight = os2.getVersion() >= 2 ? os2.getCapHeight() : 0;
            this.xHeight = os2.getVersion() >= 2 ? os2.getHeight() : 0;
        } else {
            this.familyClass = 0;
            this.capHeight = 0;
            this.xHeight = 0;
        }
        this.kind = font instanceof OpenTypeFont openType && openType.isPostScript() ? FontKind.CFF : FontKind.TRUE_TYPE;

        KerningTable kern = font.getKerning();
        this.kerning = kern != null ? kern.getHorizontalKerningSubtable() : null;

        CmapLookup cmap = font.getUnicodeCmapLookup();
        int numGlyphs = font.getNumberOfGlyphs();
        Map<Integer, Integer> byCodePoint = new TreeMap<>();
        this.glyphs = new Glyph[numGlyphs];
        for (int gid = 0; gid < numGlyphs; gid++) {
            List<Integer> codes = cmap.getCharCodes(gid);
            List<Integer> codePoints = new ArrayList<>();
            if (codes != null) {
                for (Integer code : codes) {
                    if (!isNoncharacter(code)) {
                        codePoints.add(code);
                    }
                }
            }
            Collections.sort(codePoints);
            for (Integer codePoint : codePoints) {
                byCodePoint.putIfAbsent(codePoint, gid);
            }
            glyphs[gid] = new Glyph(gid, font.getAdvanceWidth(gid), codePoints);
        }
        this.glyphIdByCodePoint = Collections.unmodifiableMap(byCodePoint);
        this.characterSet = List.copyOf(byCodePoint.keySet());
    }

    static FontBoxFontHandle load(TrueTypeFont font) throws IOException {
        if (font.getHeader() == null || font.getHorizontalHeader() == null) {
            throw new IOException("Font misses mandatory 'head' or 'hhea' table");
        }
        return new FontBoxFontHandle(font);
    }

    @Override
    public String postscriptName() {
        return postscriptName;
    }

    @Override
    public int unitsPerEm() {
        return unitsPerEm;
    }

    @Override
    public double ascent() {
        return ascent;
    }

    @Override
    public double descent() {
        return descent;
    }

    @Override
    public double capHeight() {
        return capHeight;
    }

    @Override
    public double xHeight() {
        return xHeight;
    }

    @Override
    public FontBBox bbox() {
        return bbox;
    }

    @Override
    public double italicAngle() {
        return italicAngle;
    }

    @Override
    public FontKind kind() {
        return kind;
    }

    @Override
    public boolean isFixedPitch() {
        return fixedPitch;
    }

    @Override
    public int familyClass() {
        return familyClass;
    }

    @Override
    public boolean isItalic() {
        return italic;
    }

    @Override
    public List<Integer> characterSet() {
        return characterSet;
    }

    @Override
    public Glyph glyphForCodePoint(int codePoint) {
        Integer gid = glyphIdByCodePoint.get(codePoint);
        return glyphById(gid != null ? gid : NOTDEF_GLYPH_ID);
    }

    @Override
    public List<Glyph> layout(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Glyph> shaped = new ArrayList<>(text.length());
        text.codePoints().forEach(codePoint -> shaped.add(glyphForCodePoint(codePoint)));
        if (kerning != null) {
            for (int i = 0; i + 1 < shaped.size(); i++) {
                Glyph left = shaped.get(i);
                int adjustment = kerning.getKerning(left.id(), shaped.get(i + 1).id());
                if (adjustment != 0) {
                    shaped.set(i, left.withAdvanceWidth(left.advanceWidth() + adjustment));
                }
            }
        }
        return shaped;
    }

    // Подтаблицы cmap формата 4 заканчиваются сегментом 0xFFFF.
    private static boolean isNoncharacter(int codePoint) {
        return (codePoint & 0xFFFE) == 0xFFFE;
    }

    private Glyph glyphById(int gid) {
        if (gid >= 0 && gid < glyphs.length) {
            return glyphs[gid];
        }
        return glyphs.length > 0 ? glyphs[NOTDEF_GLYPH_ID] : new Glyph(NOTDEF_GLYPH_ID, 0, List.of());
    }
}
