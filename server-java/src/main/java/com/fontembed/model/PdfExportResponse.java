package com.fontembed.model;

import org.springframework.http.ContentDisposition;

public record PdfExportResponse(
        byte[] payload,
        String baseFont,
        ContentDisposition contentDisposition
) {
}
