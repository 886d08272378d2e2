package com.fontembed.exception;

/**
 * Ошибка разбора шрифта или сборки PDF-объектов для встраивания шрифта.
 */
public class FontEmbeddingException extends RuntimeException {

    public FontEmbeddingException(String message) {
        super(message);
    }

    public FontEmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
