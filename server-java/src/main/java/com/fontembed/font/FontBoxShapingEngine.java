package com.fontembed.font;

import com.fontembed.exception.FontEmbeddingException;
import org.apache.fontbox.ttf.OTFParser;
import org.apache.fontbox.ttf.TTFParser;
import org.apache.fontbox.ttf.TrueTypeFont;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Разбор TrueType/OpenType шрифтов средствами Apache FontBox.
 */
@Component
public class FontBoxShapingEngine implements FontShapingEngine {

    private static final Logger logger = LoggerFactory.getLogger(FontBoxShapingEngine.class);

    private static final int SFNT_HEADER_SIZE = 12;
    private static final int OTTO_TAG = 0x4F54544F; // 'OTTO'

    @Override
    public FontHandle parse(byte[] fontBytes) {
        if (fontBytes == null || fontBytes.length < SFNT_HEADER_SIZE) {
            throw new FontEmbeddingException("Файл шрифта пуст или слишком короткий.");
        }
        boolean openTypeCff = ByteBuffer.wrap(fontBytes).order(ByteOrder.BIG_ENDIAN).getInt(0) == OTTO_TAG;
        try (TrueTypeFont font = openTypeCff
                ? new OTFParser().parse(new ByteArrayInputStream(fontBytes))
                : new TTFParser().parse(new ByteArrayInputStream(fontBytes))) {
            FontBoxFontHandle handle = FontBoxFontHandle.load(font);
            if (logger.isDebugEnabled()) {
                logger.debug("Font '{}' parsed: kind={}, unitsPerEm={}, codePoints={}",
                        handle.postscriptName(), handle.kind(), handle.unitsPerEm(), handle.characterSet().size());
            }
            return handle;
        } catch (IOException ex) {
            throw new FontEmbeddingException("Не удалось разобрать шрифтовую программу: " + ex.getMessage(), ex);
        }
    }
}
