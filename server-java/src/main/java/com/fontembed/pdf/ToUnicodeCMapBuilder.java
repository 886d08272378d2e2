package com.fontembed.pdf;

import com.fontembed.font.Glyph;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Собирает тело потока ToUnicode: отображение CID (= id глифа) в Unicode через bfchar.
 */
public final class ToUnicodeCMapBuilder {

    // PDF 32000-1, 9.10.3: не более 100 записей в блоке beginbfchar.
    private static final int MAX_ENTRIES_PER_BLOCK = 100;

    private static final String HEADER = """
            /CIDInit /ProcSet findresource begin
            12 dict begin
            begincmap
            /CIDSystemInfo <<
              /Registry (Adobe)
              /Ordering (UCS)
              /Supplement 0
            >> def
            /CMapName /Adobe-Identity-UCS def
            /CMapType 2 def
            1 begincodespacerange
            <0000><ffff>
            endcodespacerange
            """;

    private static final String FOOTER = """
            endcmap
            CMapName currentdict /CMap defineresource pop
            end
            end""";

    private ToUnicodeCMapBuilder() {
    }

    /**
     * Глифы с отрицательным id или без кодовых точек пропускаются.
     */
    public static byte[] build(List<Glyph> glyphs, ToIntFunction<Glyph> glyphId) {
        List<String> entries = new ArrayList<>(glyphs.size());
        for (Glyph glyph : glyphs) {
            int id = glyphId.applyAsInt(glyph);
            if (id < 0 || glyph.codePoints().isEmpty()) {
                continue;
            }
            // Несколько кодовых точек на один глиф (пробел и неразрывный пробел) отображаются в первую.
            String unicode = FontEmbeddingUtil.toUtf16Hex(glyph.codePoints().get(0));
            entries.add("<" + FontEmbeddingUtil.toHexStringOfMinLength(id, 4) + "> <" + unicode + ">");
        }

        StringBuilder cmap = new StringBuilder(HEADER);
        for (int start = 0; start < entries.size(); start += MAX_ENTRIES_PER_BLOCK) {
            List<String> block = entries.subList(start, Math.min(start + MAX_ENTRIES_PER_BLOCK, entries.size()));
            cmap.append(block.size()).append(" beginbfchar\n");
            for (String entry : block) {
                cmap.append(entry).append('\n');
            }
            cmap.append("endbfchar\n");
        }
        cmap.append(FOOTER);
        return cmap.toString().getBytes(StandardCharsets.US_ASCII);
    }
}
