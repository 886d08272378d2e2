package com.fontembed.pdf.itext;

import com.fontembed.config.FontEmbeddingProperties;
import com.fontembed.model.PageFormat;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfVersion;
import com.itextpdf.kernel.pdf.PdfWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ITextPdfResourceFactoryTest {

    private FontEmbeddingProperties properties;
    private ITextPdfResourceFactory factory;

    @BeforeEach
    void setUp() {
        properties = new FontEmbeddingProperties();
        factory = new ITextPdfResourceFactory(properties);
    }

    @Test
    void namedFormatsIgnoreTextSize() {
        assertThat(factory.resolvePageSize(PageFormat.A4, 5000, 5000)).isEqualTo(PageSize.A4);
        assertThat(factory.resolvePageSize(PageFormat.LETTER, 10, 10)).isEqualTo(PageSize.LETTER);
    }

    @Test
    void missingFormatUsesConfiguredDefault() {
        properties.setDefaultPageFormat(PageFormat.A5);

        assertThat(factory.resolvePageSize(null, 10, 10)).isEqualTo(PageSize.A5);
    }

    @Test
    void fitFormatAddsMarginsOnEverySide() {
        properties.setPageMargin(10f);

        PageSize size = factory.resolvePageSize(PageFormat.FIT, 99.2, 40);

        assertThat(size.getWidth()).isEqualTo(120f);
        assertThat(size.getHeight()).isEqualTo(60f);
    }

    @Test
    void writesConfiguredPdfVersion() throws IOException {
        properties.setPdfVersion("1.4");

        assertThat(writtenVersion()).isEqualTo(PdfVersion.PDF_1_4);
    }

    @Test
    void unknownVersionFallsBackToDefault() throws IOException {
        properties.setPdfVersion("9.9");

        assertThat(writtenVersion()).isEqualTo(PdfVersion.PDF_1_7);
    }

    private PdfVersion writtenVersion() throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (PdfDocument document = new PdfDocument(new PdfWriter(output, factory.createWriterProperties()))) {
            document.addNewPage();
        }
        try (PdfDocument document = new PdfDocument(new PdfReader(new ByteArrayInputStream(output.toByteArray())))) {
            return document.getPdfVersion();
        }
    }
}
