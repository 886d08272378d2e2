package com.fontembed.pdf;

import com.fontembed.font.Glyph;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfNumber;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Массив ширин /W для CID-шрифта в форме {@code [c [w1 w2 ...] c [w ...] ...]}.
 * Новая группа начинается всякий раз, когда id текущего глифа не равен предыдущему плюс один.
 * Форма {@code c_first c_last w} не используется.
 */
public final class CidWidthTable {

    /**
     * Подряд идущие CID начиная с {@code firstId}, по одной ширине на CID в пространстве глифов.
     */
    public record WidthRun(int firstId, List<Double> widths) {

        public WidthRun {
            widths = List.copyOf(widths);
        }

        public int lastId() {
            return firstId + widths.size() - 1;
        }
    }

    private final List<WidthRun> runs;

    private CidWidthTable(List<WidthRun> runs) {
        this.runs = Collections.unmodifiableList(runs);
    }

    /**
     * @param glyphs  каталог по возрастанию id
     * @param scale   множитель из единиц шрифта в пространство глифов
     * @param glyphId способ получения id для разбиения на группы
     */
    public static CidWidthTable compute(List<Glyph> glyphs, double scale, ToIntFunction<Glyph> glyphId) {
        List<WidthRun> runs = new ArrayList<>();
        int runStart = 0;
        List<Double> section = new ArrayList<>();
        for (int idx = 0; idx < glyphs.size(); idx++) {
            Glyph currGlyph = glyphs.get(idx);
            int currGlyphId = glyphId.applyAsInt(currGlyph);
            if (idx == 0) {
                runStart = currGlyphId;
            } else if (currGlyphId - glyphId.applyAsInt(glyphs.get(idx - 1)) != 1) {
                runs.add(new WidthRun(runStart, section));
                section = new ArrayList<>();
                runStart = currGlyphId;
            }
            section.add(currGlyph.advanceWidth() * scale);
        }
        if (!section.isEmpty()) {
            runs.add(new WidthRun(runStart, section));
        }
        return new CidWidthTable(runs);
    }

    public List<WidthRun> runs() {
        return runs;
    }

    public PdfArray toPdfArray() {
        PdfArray array = new PdfArray();
        for (WidthRun run : runs) {
            array.add(new PdfNumber(run.firstId()));
            PdfArray widths = new PdfArray();
            for (Double width : run.widths()) {
                widths.add(new PdfNumber(width));
            }
            array.add(widths);
        }
        return array;
    }
}
