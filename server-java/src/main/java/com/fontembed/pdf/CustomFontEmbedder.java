package com.fontembed.pdf;

import com.fontembed.exception.FontEmbeddingException;
import com.fontembed.font.FontBBox;
import com.fontembed.font.FontHandle;
import com.fontembed.font.FontShapingEngine;
import com.fontembed.font.Glyph;
import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Встраивает произвольный TrueType/OpenType шрифт в PDF как составной шрифт Type0
 * с кодировкой Identity-H: словарь Type0, дочерний CIDFont, дескриптор, массив ширин /W,
 * поток ToUnicode и сам файл шрифта.
 *
 * <p>Все метрики шрифта переводятся в пространство глифов PDF (1000 единиц на em)
 * умножением на {@code 1000 / unitsPerEm}.
 *
 * <p>Экземпляр не потокобезопасен: одновременно допускается только один вызов {@link #embed}.
 */
public class CustomFontEmbedder {

    private static final Logger logger = LoggerFactory.getLogger(CustomFontEmbedder.class);

    static final double GLYPH_SPACE_UNITS_PER_EM = 1000d;
    static final int NO_GLYPH_ID = -1;

    private static final PdfName IDENTITY_H = new PdfName("Identity-H");
    private static final PdfName CID_FONT_TYPE_0C = new PdfName("CIDFontType0C");
    private static final PdfName X_HEIGHT = new PdfName("XHeight");

    private final FontHandle font;
    private final byte[] fontData;
    private final double scale;
    private final Random random;
    private final String customName;

    private String fontName = "";
    private GlyphCatalog glyphCatalog;

    protected CustomFontEmbedder(FontHandle font, byte[] fontData, Random random, String customName) {
        this.font = Objects.requireNonNull(font, "font");
        this.fontData = Objects.requireNonNull(fontData, "fontData").clone();
        this.random = Objects.requireNonNull(random, "random");
        this.customName = customName;
        if (font.unitsPerEm() <= 0) {
            throw new FontEmbeddingException("Некорректное значение unitsPerEm: " + font.unitsPerEm());
        }
        this.scale = GLYPH_SPACE_UNITS_PER_EM / font.unitsPerEm();
    }

    public static CustomFontEmbedder create(byte[] fontData, FontShapingEngine engine, Random random) {
        return create(fontData, engine, random, null);
    }

    /**
     * @param customName заменяет PostScript-имя в префиксе BaseFont, может быть {@code null}
     */
    public static CustomFontEmbedder create(byte[] fontData, FontShapingEngine engine, Random random, String customName) {
        FontHandle font = engine.parse(fontData);
        return new CustomFontEmbedder(font, fontData, random, customName);
    }

    public static CustomFontEmbedder forHandle(FontHandle font, byte[] fontData, Random random) {
        return new CustomFontEmbedder(font, fontData, random, null);
    }

    public FontHandle getFont() {
        return font;
    }

    public double getScale() {
        return scale;
    }

    /**
     * BaseFont, назначенный последним вызовом {@link #embed}; пустая строка до первого вызова.
     */
    public String getFontName() {
        return fontName;
    }

    /**
     * Кодирует {@code text} кодами Identity-H: четыре hex-цифры на id каждого глифа.
     */
    public String encodeText(String text) {
        List<Glyph> glyphs = font.layout(text);
        StringBuilder hexCodes = new StringBuilder(glyphs.size() * 4);
        for (Glyph glyph : glyphs) {
            hexCodes.append(FontEmbeddingUtil.toHexStringOfMinLength(glyph.id(), 4));
        }
        return hexCodes.toString();
    }

    /**
     * Ширины после раскладки уже содержат кернинг, отдельного прохода нет.
     */
    public double widthOfTextAtSize(String text, double size) {
        double totalWidth = 0;
        for (Glyph glyph : font.layout(text)) {
            totalWidth += glyph.advanceWidth() * scale;
        }
        return totalWidth * (size / GLYPH_SPACE_UNITS_PER_EM);
    }

    public double heightOfFontAtSize(double size) {
        return ((scaledTop() - scaledBottom()) / GLYPH_SPACE_UNITS_PER_EM) * size;
    }

    /**
     * Расстояние от базовой линии до линии спуска при кегле {@code size}, положительное число.
     */
    public double descentAtSize(double size) {
        return (-scaledBottom() / GLYPH_SPACE_UNITS_PER_EM) * size;
    }

    public double sizeOfFontAtHeight(double height) {
        double span = scaledTop() - scaledBottom();
        if (span == 0) {
            throw new FontEmbeddingException("Шрифт имеет нулевую высоту (ascent == descent), размер не определён.");
        }
        return (GLYPH_SPACE_UNITS_PER_EM * height) / span;
    }

    /**
     * Регистрирует объекты шрифта в {@code writer} и возвращает ссылку на словарь Type0.
     * Каждый вызов выбирает новый суффикс BaseFont и пишет новый набор объектов.
     */
    public PdfIndirectReference embed(PdfObjectWriter writer) {
        String prefix = customName != null && !customName.isBlank() ? customName : font.postscriptName();
        this.fontName = FontEmbeddingUtil.addRandomSuffix(prefix, random);
        try {
            PdfIndirectReference reference = embedType0Font(writer);
            logger.debug("Font '{}' embedded as Type0 ({}), glyphs={}", fontName, font.kind(), glyphs().size());
            return reference;
        } catch (ITextException ex) {
            throw new FontEmbeddingException("Не удалось встроить шрифт '" + fontName + "' в PDF.", ex);
        }
    }

    /**
     * Каталог глифов всего шрифта; строится при первом обращении и затем переиспользуется.
     */
    public List<Glyph> glyphs() {
        if (glyphCatalog == null) {
            glyphCatalog = GlyphCatalog.of(font);
        }
        return glyphCatalog.glyphs();
    }

    public CidWidthTable computeWidths() {
        return CidWidthTable.compute(glyphs(), scale, this::glyphId);
    }

    protected boolean isCff() {
        return font.kind().isCff();
    }

    /**
     * Байты потока шрифтовой программы. Шрифт встраивается целиком.
     */
    protected byte[] serializeFont() {
        return fontData;
    }

    protected int glyphId(Glyph glyph) {
        return glyph != null ? glyph.id() : NO_GLYPH_ID;
    }

    private PdfIndirectReference embedType0Font(PdfObjectWriter writer) {
        PdfIndirectReference cidFontRef = embedCidFont(writer);
        PdfIndirectReference toUnicodeRef = embedToUnicodeCMap(writer);

        Map<PdfName, PdfObject> entries = new LinkedHashMap<>();
        entries.put(PdfName.Type, PdfName.Font);
        entries.put(PdfName.Subtype, PdfName.Type0);
        entries.put(PdfName.BaseFont, new PdfName(fontName));
        entries.put(PdfName.Encoding, IDENTITY_H);
        entries.put(PdfName.DescendantFonts, new PdfArray(cidFontRef));
        entries.put(PdfName.ToUnicode, toUnicodeRef);
        return writer.register(writer.obj(entries));
    }

    private PdfIndirectReference embedCidFont(PdfObjectWriter writer) {
        PdfIndirectReference descriptorRef = embedFontDescriptor(writer);

        PdfDictionary systemInfo = new PdfDictionary();
        systemInfo.put(PdfName.Registry, new PdfString("Adobe"));
        systemInfo.put(PdfName.Ordering, new PdfString("Identity"));
        systemInfo.put(PdfName.Supplement, new PdfNumber(0));

        Map<PdfName, PdfObject> entries = new LinkedHashMap<>();
        entries.put(PdfName.Type, PdfName.Font);
        entries.put(PdfName.Subtype, isCff() ? PdfName.CIDFontType0 : PdfName.CIDFontType2);
        entries.put(PdfName.BaseFont, new PdfName(fontName));
        entries.put(PdfName.CIDSystemInfo, systemInfo);
        entries.put(PdfName.FontDescriptor, descriptorRef);
        entries.put(PdfName.W, computeWidths().toPdfArray());
        return writer.register(writer.obj(entries));
    }

    private PdfIndirectReference embedFontDescriptor(PdfObjectWriter writer) {
        PdfIndirectReference fontFileRef = embedFontStream(writer);

        FontBBox bbox = font.bbox();
        double ascent = font.ascent();
        double capHeight = font.capHeight() != 0 ? font.capHeight() : ascent;

        Map<PdfName, PdfObject> entries = new LinkedHashMap<>();
        entries.put(PdfName.Type, PdfName.FontDescriptor);
        entries.put(PdfName.FontName, new PdfName(fontName));
        entries.put(PdfName.Flags, new PdfNumber(FontFlags.derive(font)));
        entries.put(PdfName.FontBBox, new PdfArray(new double[]{
                bbox.minX() * scale, bbox.minY() * scale, bbox.maxX() * scale, bbox.maxY() * scale}));
        entries.put(PdfName.ItalicAngle, new PdfNumber(font.italicAngle()));
        entries.put(PdfName.Ascent, new PdfNumber(ascent * scale));
        entries.put(PdfName.Descent, new PdfNumber(font.descent() * scale));
        entries.put(PdfName.CapHeight, new PdfNumber(capHeight * scale));
        entries.put(X_HEIGHT, new PdfNumber(font.xHeight() * scale));
        // Надёжного источника толщины штриха в TrueType/CFF нет.
        entries.put(PdfName.StemV, new PdfNumber(0));
        entries.put(isCff() ? PdfName.FontFile3 : PdfName.FontFile2, fontFileRef);
        return writer.register(writer.obj(entries));
    }

    private PdfIndirectReference embedFontStream(PdfObjectWriter writer) {
        // TODO: для FontFile2 перейти на /OpenType или убрать /Subtype после проверки целевых просмотрщиков.
        PdfStream fontStream = writer.flateStream(serializeFont(), Map.of(PdfName.Subtype, CID_FONT_TYPE_0C));
        return writer.register(fontStream);
    }

    private PdfIndirectReference embedToUnicodeCMap(PdfObjectWriter writer) {
        byte[] cmap = ToUnicodeCMapBuilder.build(glyphs(), this::glyphId);
        return writer.register(writer.flateStream(cmap));
    }

    private double scaledTop() {
        double ascent = font.ascent();
        return (ascent != 0 ? ascent : font.bbox().maxY()) * scale;
    }

    private double scaledBottom() {
        double descent = font.descent();
        return (descent != 0 ? descent : font.bbox().minY()) * scale;
    }
}
