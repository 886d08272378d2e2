package com.fontembed.analysis;

import com.fontembed.exception.FontEmbeddingException;
import com.fontembed.font.FakeFontHandle;
import com.fontembed.font.FontKind;
import com.fontembed.model.EmbeddedFontInfo;
import com.fontembed.pdf.CustomFontEmbedder;
import com.fontembed.pdf.itext.ITextPdfObjectWriter;
import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.xobject.PdfFormXObject;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddedFontInspectorTest {

    private final EmbeddedFontInspector inspector = new EmbeddedFontInspector();

    @Test
    void findsFontsInPageAndFormResources() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        String pageFont;
        String formFont;
        try (PdfDocument document = new PdfDocument(new PdfWriter(output))) {
            PdfPage page = document.addNewPage();
            ITextPdfObjectWriter writer = new ITextPdfObjectWriter(document);

            CustomFontEmbedder trueType = CustomFontEmbedder.forHandle(
                    new FakeFontHandle().postscriptName("PageFont").map('a', 1, 500), new byte[]{1}, new Random(1));
            page.getResources().getPdfObject().put(PdfName.Font, fontResources("F1", trueType.embed(writer)));
            pageFont = trueType.getFontName();

            CustomFontEmbedder cff = CustomFontEmbedder.forHandle(
                    new FakeFontHandle().postscriptName("FormFont").kind(FontKind.CFF), new byte[]{2}, new Random(2));
            PdfFormXObject form = new PdfFormXObject(new Rectangle(100, 100));
            PdfDictionary formResources = new PdfDictionary();
            formResources.put(PdfName.Font, fontResources("F2", cff.embed(writer)));
            form.getPdfObject().put(PdfName.Resources, formResources);
            page.getResources().addForm(form);
            formFont = cff.getFontName();
        }

        List<EmbeddedFontInfo> fonts = inspector.inspect(output.toByteArray());

        assertThat(fonts).extracting(EmbeddedFontInfo::baseFont).containsExactly(formFont, pageFont);
        EmbeddedFontInfo form = fonts.get(0);
        assertThat(form.resourceName()).isEqualTo("F2");
        assertThat(form.descendantSubtype()).isEqualTo("CIDFontType0");
        assertThat(form.fontFileKey()).isEqualTo("FontFile3");
        assertThat(form.widthEntries()).isZero();
        EmbeddedFontInfo page = fonts.get(1);
        assertThat(page.descendantSubtype()).isEqualTo("CIDFontType2");
        assertThat(page.fontFileKey()).isEqualTo("FontFile2");
        assertThat(page.widthEntries()).isEqualTo(2);
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> inspector.inspect(new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wrapsUnreadablePdf() {
        assertThatThrownBy(() -> inspector.inspect(new byte[]{'%', 'P', 'D', 'F'}))
                .isInstanceOf(FontEmbeddingException.class);
    }

    @Test
    void wrapsBytesWithoutPdfHeader() {
        assertThatThrownBy(() -> inspector.inspect("not a pdf at all".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(FontEmbeddingException.class)
                .hasCauseInstanceOf(ITextException.class);
    }

    private PdfDictionary fontResources(String name, PdfIndirectReference font) {
        PdfDictionary fonts = new PdfDictionary();
        fonts.put(new PdfName(name), font);
        return fonts;
    }
}
