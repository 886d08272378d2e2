package com.fontembed.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public class FontSampleRequest {

    @NotBlank
    @Size(max = 2000, message = "text не должен превышать 2000 символов")
    private String text;

    @Positive
    private Double size;

    private PageFormat pageFormat;

    private String name;

    // Переопределяет PostScript-имя в BaseFont (суффикс добавляется всегда)
    private String fontName;

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public Double getSize() {
        return size;
    }

    public void setSize(Double size) {
        this.size = size;
    }

    public PageFormat getPageFormat() {
        return pageFormat;
    }

    public void setPageFormat(PageFormat pageFormat) {
        this.pageFormat = pageFormat;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getFontName() {
        return fontName;
    }

    public void setFontName(String fontName) {
        this.fontName = fontName;
    }
}
