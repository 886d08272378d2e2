package com.fontembed.font;

/**
 * Разбирает байты шрифтовой программы в {@link FontHandle}.
 */
public interface FontShapingEngine {

    /**
     * @throws com.fontembed.exception.FontEmbeddingException если байты не являются читаемым шрифтом
     */
    FontHandle parse(byte[] fontBytes);
}
