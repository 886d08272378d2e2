package com.fontembed.controller;

import com.fontembed.exception.FontEmbeddingException;
import com.fontembed.model.EmbeddedFontInfo;
import com.fontembed.model.FontMeasureResponse;
import com.fontembed.model.FontSampleRequest;
import com.fontembed.model.PdfExportResponse;
import com.fontembed.service.FontEmbeddingService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/fonts")
public class FontController {

    static final String BASE_FONT_HEADER = "X-Base-Font";

    private final FontEmbeddingService fontEmbeddingService;

    public FontController(FontEmbeddingService fontEmbeddingService) {
        this.fontEmbeddingService = fontEmbeddingService;
    }

    @PostMapping(value = "/measure", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public FontMeasureResponse measure(
            @RequestPart("font") MultipartFile font,
            @RequestParam(value = "text", defaultValue = "") String text,
            @RequestParam(value = "size", required = false) Double size
    ) {
        return fontEmbeddingService.measure(readBytes(font), text, size);
    }

    @PostMapping(value = "/sample", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> sample(
            @RequestPart("font") MultipartFile font,
            @Valid @ModelAttribute FontSampleRequest request
    ) {
        PdfExportResponse response = fontEmbeddingService.renderSample(readBytes(font), request);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_PDF);
        headers.setContentDisposition(response.contentDisposition());
        headers.set(BASE_FONT_HEADER, response.baseFont());
        return ResponseEntity
                .ok()
                .headers(headers)
                .body(response.payload());
    }

    @PostMapping(value = "/inspect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public List<EmbeddedFontInfo> inspect(@RequestPart("pdf") MultipartFile pdf) {
        return fontEmbeddingService.inspect(readBytes(pdf));
    }

    private byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException ex) {
            throw new FontEmbeddingException("Не удалось прочитать загруженный файл.", ex);
        }
    }
}
