package com.fontembed.pdf.itext;

import com.fontembed.pdf.PdfObjectWriter;
import com.itextpdf.kernel.pdf.CompressionConstants;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;

import java.util.Map;
import java.util.Objects;

/**
 * {@link PdfObjectWriter} поверх {@link PdfDocument} iText 7.
 */
public class ITextPdfObjectWriter implements PdfObjectWriter {

    private final PdfDocument document;

    public ITextPdfObjectWriter(PdfDocument document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    @Override
    public PdfDictionary obj(Map<PdfName, PdfObject> entries) {
        return new PdfDictionary(entries);
    }

    @Override
    public PdfIndirectReference register(PdfObject payload) {
        return payload.makeIndirect(document).getIndirectReference();
    }

    @Override
    public PdfStream flateStream(byte[] bytes, Map<PdfName, PdfObject> extraEntries) {
        PdfStream stream = new PdfStream(bytes, CompressionConstants.DEFAULT_COMPRESSION);
        extraEntries.forEach(stream::put);
        return stream;
    }
}
