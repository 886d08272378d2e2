package com.fontembed.pdf;

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;

import java.util.Map;

/**
 * Запись низкоуровневых PDF-объектов в документ: словари, сжатые потоки и косвенные ссылки.
 */
public interface PdfObjectWriter {

    PdfDictionary obj(Map<PdfName, PdfObject> entries);

    PdfIndirectReference register(PdfObject payload);

    /**
     * Создаёт поток, сжимаемый Flate при записи; {@code extraEntries} добавляются
     * в его словарь.
     */
    PdfStream flateStream(byte[] bytes, Map<PdfName, PdfObject> extraEntries);

    default PdfStream flateStream(byte[] bytes) {
        return flateStream(bytes, Map.of());
    }
}
