package com.fontembed.service;

import com.fontembed.analysis.EmbeddedFontInspector;
import com.fontembed.config.FontEmbeddingProperties;
import com.fontembed.exception.FontEmbeddingException;
import com.fontembed.font.FontShapingEngine;
import com.fontembed.model.EmbeddedFontInfo;
import com.fontembed.model.FontMeasureResponse;
import com.fontembed.model.FontSampleRequest;
import com.fontembed.model.PdfExportResponse;
import com.fontembed.pdf.CustomFontEmbedder;
import com.fontembed.pdf.itext.ITextPdfObjectWriter;
import com.fontembed.pdf.itext.ITextPdfResourceFactory;
import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

@Service
public class FontEmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(FontEmbeddingService.class);

    private static final PdfName FONT_RESOURCE_NAME = new PdfName("F1");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]+");

    private final FontShapingEngine shapingEngine;
    private final ITextPdfResourceFactory pdfResourceFactory;
    private final EmbeddedFontInspector fontInspector;
    private final FontEmbeddingProperties properties;
    private final Random fontNameRandom;

    public FontEmbeddingService(FontShapingEngine shapingEngine,
                                ITextPdfResourceFactory pdfResourceFactory,
                                EmbeddedFontInspector fontInspector,
                                FontEmbeddingProperties properties,
                                Random fontNameRandom) {
        this.shapingEngine = shapingEngine;
        this.pdfResourceFactory = pdfResourceFactory;
        this.fontInspector = fontInspector;
        this.properties = properties;
        this.fontNameRandom = fontNameRandom;
    }

    public FontMeasureResponse measure(byte[] fontBytes, String text, Double requestedSize) {
        CustomFontEmbedder embedder = createEmbedder(fontBytes, null);
        double size = resolveSize(requestedSize);
        String safeText = text != null ? text : "";
        double height = embedder.heightOfFontAtSize(size);
        // У шрифта с нулевой высотой обратного размера нет, остальные метрики считаются как обычно.
        Double sizeForHeight = height != 0 ? embedder.sizeOfFontAtHeight(height) : null;
        return new FontMeasureResponse(
                embedder.getFont().postscriptName(),
                embedder.getFont().kind(),
                embedder.getFont().unitsPerEm(),
                embedder.glyphs().size(),
                embedder.encodeText(safeText),
                size,
                embedder.widthOfTextAtSize(safeText, size),
                height,
                sizeForHeight
        );
    }

    /**
     * Строит одностраничный PDF с текстом, набранным встроенным шрифтом.
     * При ошибке на любом шаге документ целиком отбрасывается.
     */
    public PdfExportResponse renderSample(byte[] fontBytes, FontSampleRequest request) {
        long startNs = System.nanoTime();
        CustomFontEmbedder embedder = createEmbedder(fontBytes, request.getFontName());
        double size = resolveSize(request.getSize());
        List<String> lines = LINE_BREAK.splitAsStream(request.getText()).toList();

        double lineHeight = embedder.heightOfFontAtSize(size);
        double textWidth = 0;
        for (String line : lines) {
            textWidth = Math.max(textWidth, embedder.widthOfTextAtSize(line, size));
        }

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        String baseFont;
        try (PdfDocument pdfDocument = new PdfDocument(new PdfWriter(output, pdfResourceFactory.createWriterProperties()))) {
            PageSize pageSize = pdfResourceFactory.resolvePageSize(request.getPageFormat(), textWidth, lineHeight * lines.size());
            PdfPage page = pdfDocument.addNewPage(pageSize);

            PdfIndirectReference fontRef = embedder.embed(new ITextPdfObjectWriter(pdfDocument));
            baseFont = embedder.getFontName();

            PdfDictionary fontResources = new PdfDictionary();
            fontResources.put(FONT_RESOURCE_NAME, fontRef);
            page.getResources().getPdfObject().put(PdfName.Font, fontResources);

            float margin = properties.getPageMargin();
            double baseline = pageSize.getTop() - margin - lineHeight + embedder.descentAtSize(size);
            page.newContentStreamAfter().setData(buildTextContent(embedder, lines, size, margin, baseline, lineHeight));
        } catch (ITextException ex) {
            throw new FontEmbeddingException("Не удалось собрать PDF с встроенным шрифтом.", ex);
        }

        byte[] pdfBytes = output.toByteArray();
        long elapsedMs = (System.nanoTime() - startNs) / 1_000_000L;
        logger.info("PDF со шрифтом '{}' собран: размер={} байт, строк={}, size={}, время={} мс",
                baseFont, pdfBytes.length, lines.size(), size, elapsedMs);

        String fileName = sanitizeName(request.getName(), "font-sample") + ".pdf";
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(fileName, StandardCharsets.UTF_8)
                .build();
        return new PdfExportResponse(pdfBytes, baseFont, disposition);
    }

    public List<EmbeddedFontInfo> inspect(byte[] pdfBytes) {
        List<EmbeddedFontInfo> fonts = fontInspector.inspect(pdfBytes);
        logger.debug("Inspected PDF: {} fonts", fonts.size());
        return fonts;
    }

    private CustomFontEmbedder createEmbedder(byte[] fontBytes, String fontName) {
        if (fontBytes == null || fontBytes.length == 0) {
            throw new FontEmbeddingException("Файл шрифта не передан.");
        }
        if (fontBytes.length > properties.getMaxFontBytes()) {
            throw new FontEmbeddingException("Файл шрифта превышает допустимый размер "
                    + properties.getMaxFontBytes() + " байт.");
        }
        return CustomFontEmbedder.create(fontBytes, shapingEngine, fontNameRandom, fontName);
    }

    private byte[] buildTextContent(CustomFontEmbedder embedder, List<String> lines, double size,
                                    float x, double baseline, double leading) {
        StringBuilder content = new StringBuilder();
        content.append("BT\n");
        content.append('/').append(FONT_RESOURCE_NAME.getValue()).append(' ').append(format(size)).append(" Tf\n");
        content.append(format(leading)).append(" TL\n");
        content.append(format(x)).append(' ').append(format(baseline)).append(" Td\n");
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                content.append("T*\n");
            }
            content.append('<').append(embedder.encodeText(lines.get(i))).append("> Tj\n");
        }
        content.append("ET\n");
        return content.toString().getBytes(StandardCharsets.US_ASCII);
    }

    private double resolveSize(Double requestedSize) {
        if (requestedSize == null || requestedSize <= 0) {
            return properties.getDefaultFontSize();
        }
        return requestedSize;
    }

    private String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private String sanitizeName(String name, String fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        String sanitized = UNSAFE_FILE_CHARS.matcher(name.trim()).replaceAll("_");
        return sanitized.isEmpty() ? fallback : sanitized;
    }
}
