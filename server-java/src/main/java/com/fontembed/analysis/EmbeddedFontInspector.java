package com.fontembed.analysis;

import com.fontembed.exception.FontEmbeddingException;
import com.fontembed.model.EmbeddedFontInfo;
import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfResources;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Инспекция шрифтов в готовом PDF на базе iText 7.
 * Используется эндпоинтом /fonts/inspect и регрессионными тестами встраивания.
 */
@Component
public class EmbeddedFontInspector {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddedFontInspector.class);

    private static final PdfName[] FONT_FILE_KEYS = {PdfName.FontFile, PdfName.FontFile2, PdfName.FontFile3};

    public List<EmbeddedFontInfo> inspect(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new IllegalArgumentException("pdfBytes не должны быть пустыми");
        }
        try (PdfDocument pdfDocument = new PdfDocument(new PdfReader(new ByteArrayInputStream(pdfBytes)))) {
            Map<String, EmbeddedFontInfo> fonts = new TreeMap<>();
            for (int pageIndex = 1; pageIndex <= pdfDocument.getNumberOfPages(); pageIndex++) {
                collectFonts(pdfDocument.getPage(pageIndex).getResources(), fonts);
            }
            return List.copyOf(fonts.values());
        } catch (IOException | ITextException ex) {
            logger.error("Не удалось прочитать PDF для инспекции шрифтов", ex);
            throw new FontEmbeddingException("Не удалось прочитать PDF для инспекции шрифтов", ex);
        }
    }

    private void collectFonts(PdfResources resources, Map<String, EmbeddedFontInfo> fonts) {
        if (resources == null) {
            return;
        }
        Set<PdfName> fontNames = resources.getResourceNames(PdfName.Font);
        if (fontNames != null) {
            for (PdfName fontName : fontNames) {
                PdfObject fontObject = resources.getResourceObject(PdfName.Font, fontName);
                if (fontObject instanceof PdfDictionary fontDict) {
                    EmbeddedFontInfo info = describe(fontName.getValue(), fontDict);
                    fonts.putIfAbsent(info.baseFont() != null ? info.baseFont() : fontName.getValue(), info);
                }
            }
        }

        Set<PdfName> xObjectNames = resources.getResourceNames(PdfName.XObject);
        if (xObjectNames != null) {
            for (PdfName xObjectName : xObjectNames) {
                PdfObject xObject = resources.getResourceObject(PdfName.XObject, xObjectName);
                if (xObject instanceof PdfStream stream && PdfName.Form.equals(stream.getAsName(PdfName.Subtype))) {
                    PdfDictionary formResourcesDict = stream.getAsDictionary(PdfName.Resources);
                    if (formResourcesDict != null) {
                        collectFonts(new PdfResources(formResourcesDict), fonts);
                    }
                }
            }
        }
    }

    private EmbeddedFontInfo describe(String resourceName, PdfDictionary fontDict) {
        String baseFont = nameValue(fontDict.getAsName(PdfName.BaseFont));
        String subtype = nameValue(fontDict.getAsName(PdfName.Subtype));
        String encoding = nameValue(fontDict.getAsName(PdfName.Encoding));
        boolean hasToUnicode = fontDict.get(PdfName.ToUnicode) != null;

        PdfDictionary descendant = null;
        PdfArray descendants = fontDict.getAsArray(PdfName.DescendantFonts);
        if (descendants != null && !descendants.isEmpty()) {
            descendant = descendants.getAsDictionary(0);
        }

        String descendantSubtype = null;
        String cidOrdering = null;
        int widthEntries = 0;
        PdfDictionary descriptor = fontDict.getAsDictionary(PdfName.FontDescriptor);
        if (descendant != null) {
            descendantSubtype = nameValue(descendant.getAsName(PdfName.Subtype));
            PdfDictionary systemInfo = descendant.getAsDictionary(PdfName.CIDSystemInfo);
            if (systemInfo != null) {
                PdfString ordering = systemInfo.getAsString(PdfName.Ordering);
                cidOrdering = ordering != null ? ordering.toUnicodeString() : null;
            }
            PdfArray widths = descendant.getAsArray(PdfName.W);
            widthEntries = widths != null ? widths.size() : 0;
            descriptor = descendant.getAsDictionary(PdfName.FontDescriptor);
        }

        String fontFileKey = null;
        if (descriptor != null) {
            for (PdfName key : FONT_FILE_KEYS) {
                if (descriptor.get(key) != null) {
                    fontFileKey = key.getValue();
                    break;
                }
            }
        }
        return new EmbeddedFontInfo(resourceName, baseFont, subtype, encoding, descendantSubtype,
                cidOrdering, fontFileKey, hasToUnicode, widthEntries);
    }

    private String nameValue(PdfName name) {
        return name != null ? name.getValue() : null;
    }
}
