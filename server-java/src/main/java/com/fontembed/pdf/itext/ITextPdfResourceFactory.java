package com.fontembed.pdf.itext;

import com.fontembed.config.FontEmbeddingProperties;
import com.fontembed.model.PageFormat;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfVersion;
import com.itextpdf.kernel.pdf.WriterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Базовые настройки iText 7 для документов со встроенными шрифтами: версия PDF и размер страницы.
 */
@Component
public class ITextPdfResourceFactory {

    private static final Logger logger = LoggerFactory.getLogger(ITextPdfResourceFactory.class);

    // Составным шрифтам с ToUnicode нужен PDF 1.2 и выше, потокам объектов нужен 1.5.
    private static final PdfVersion DEFAULT_PDF_VERSION = PdfVersion.PDF_1_7;

    private final FontEmbeddingProperties properties;

    public ITextPdfResourceFactory(FontEmbeddingProperties properties) {
        this.properties = properties;
    }

    /**
     * Создаёт {@link WriterProperties} с версией PDF из настроек.
     */
    public WriterProperties createWriterProperties() {
        WriterProperties writerProperties = new WriterProperties();
        PdfVersion version = resolvePdfVersion(properties.getPdfVersion());
        writerProperties.setPdfVersion(version);
        if (version.compareTo(PdfVersion.PDF_1_5) >= 0) {
            writerProperties.setFullCompressionMode(true);
        }
        return writerProperties;
    }

    /**
     * Размер страницы для формата; для {@link PageFormat#FIT} страница охватывает текст с полями.
     */
    public PageSize resolvePageSize(PageFormat format, double textWidth, double textHeight) {
        PageFormat effective = format != null ? format : properties.getDefaultPageFormat();
        return switch (effective) {
            case A4 -> PageSize.A4;
            case A5 -> PageSize.A5;
            case LETTER -> PageSize.LETTER;
            case FIT -> {
                float margin = properties.getPageMargin();
                float width = (float) Math.ceil(textWidth) + 2 * margin;
                float height = (float) Math.ceil(textHeight) + 2 * margin;
                yield new PageSize(Math.max(width, 1f), Math.max(height, 1f));
            }
        };
    }

    private PdfVersion resolvePdfVersion(String explicitVersion) {
        if (explicitVersion == null || explicitVersion.isBlank()) {
            return DEFAULT_PDF_VERSION;
        }
        String normalized = explicitVersion.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "1.3" -> PdfVersion.PDF_1_3;
            case "1.4" -> PdfVersion.PDF_1_4;
            case "1.5" -> PdfVersion.PDF_1_5;
            case "1.6" -> PdfVersion.PDF_1_6;
            case "1.7" -> PdfVersion.PDF_1_7;
            case "2.0" -> PdfVersion.PDF_2_0;
            default -> {
                logger.warn("Неподдерживаемая версия PDF '{}'. Используется версия по умолчанию {}.", explicitVersion, DEFAULT_PDF_VERSION);
                yield DEFAULT_PDF_VERSION;
            }
        };
    }
}
