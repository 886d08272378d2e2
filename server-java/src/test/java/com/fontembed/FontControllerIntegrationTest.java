package com.fontembed;

import com.fontembed.font.TestFonts;
import com.fontembed.model.EmbeddedFontInfo;
import com.fontembed.service.FontEmbeddingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FontControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private FontEmbeddingService fontEmbeddingService;

    @Test
    @DisplayName("POST /fonts/measure возвращает метрики и коды глифов")
    void measureReturnsMetrics() throws Exception {
        mockMvc.perform(multipart("/fonts/measure")
                        .file(fontFile())
                        .param("text", "AZ")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.postscriptName").value(TestFonts.SAMPLE_NAME))
                .andExpect(jsonPath("$.kind").value("truetype"))
                .andExpect(jsonPath("$.unitsPerEm").value(2000))
                .andExpect(jsonPath("$.glyphCount").value(5))
                .andExpect(jsonPath("$.encodedText").value("00030009"))
                .andExpect(jsonPath("$.height", closeTo(11.0, 1e-9)));
    }

    @Test
    @DisplayName("POST /fonts/sample возвращает PDF со встроенным шрифтом")
    void sampleReturnsPdfWithEmbeddedFont() throws Exception {
        MockHttpServletResponse response = mockMvc.perform(multipart("/fonts/sample")
                        .file(fontFile())
                        .param("text", "ABC")
                        .param("size", "18")
                        .param("pageFormat", "fit")
                        .param("name", "sample"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition", containsString("sample.pdf")))
                .andReturn()
                .getResponse();

        String baseFont = response.getHeader("X-Base-Font");
        assertThat(baseFont).startsWith(TestFonts.SAMPLE_NAME + "-");

        List<EmbeddedFontInfo> fonts = fontEmbeddingService.inspect(response.getContentAsByteArray());
        assertThat(fonts).singleElement().satisfies(font -> {
            assertThat(font.baseFont()).isEqualTo(baseFont);
            assertThat(font.encoding()).isEqualTo("Identity-H");
            assertThat(font.hasToUnicode()).isTrue();
        });
    }

    @Test
    void inspectListsFontsOfUploadedPdf() throws Exception {
        MockHttpServletResponse sample = mockMvc.perform(multipart("/fonts/sample")
                        .file(fontFile())
                        .param("text", "Z"))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse();
        MockMultipartFile pdf = new MockMultipartFile("pdf", "sample.pdf", "application/pdf",
                sample.getContentAsByteArray());

        mockMvc.perform(multipart("/fonts/inspect").file(pdf))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].baseFont").value(sample.getHeader("X-Base-Font")))
                .andExpect(jsonPath("$[0].subtype").value("Type0"))
                .andExpect(jsonPath("$[0].descendantSubtype").value("CIDFontType2"))
                .andExpect(jsonPath("$[0].fontFileKey").value("FontFile2"))
                .andExpect(jsonPath("$[0].widthEntries").value(6));
    }

    @Test
    @DisplayName("Повреждённый шрифт даёт 400 FONT_EMBEDDING_FAILED")
    void malformedFontIsBadRequest() throws Exception {
        MockMultipartFile broken = new MockMultipartFile("font", "broken.ttf", "font/ttf",
                "this is not a font at all".getBytes(StandardCharsets.US_ASCII));

        mockMvc.perform(multipart("/fonts/measure").file(broken).param("text", "A"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("FONT_EMBEDDING_FAILED"))
                .andExpect(jsonPath("$.path").value("/fonts/measure"));
    }

    @Test
    void blankSampleTextFailsValidation() throws Exception {
        mockMvc.perform(multipart("/fonts/sample")
                        .file(fontFile())
                        .param("text", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("POST /fonts/inspect с не-PDF даёт 400")
    void inspectOfNonPdfIsBadRequest() throws Exception {
        MockMultipartFile notPdf = new MockMultipartFile("pdf", "notes.pdf", "application/pdf",
                "not a pdf at all".getBytes(StandardCharsets.US_ASCII));

        mockMvc.perform(multipart("/fonts/inspect").file(notPdf))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("FONT_EMBEDDING_FAILED"));
    }

    @Test
    void missingFontPartIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/fonts/measure").param("text", "A"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    private MockMultipartFile fontFile() {
        return new MockMultipartFile("font", "sample.ttf", "font/ttf", TestFonts.sample());
    }
}
