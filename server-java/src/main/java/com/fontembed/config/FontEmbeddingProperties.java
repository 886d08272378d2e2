package com.fontembed.config;

import com.fontembed.model.PageFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Настройки встраивания шрифтов ({@code font-embed.*} в application.yml).
 */
@ConfigurationProperties(prefix = "font-embed")
public class FontEmbeddingProperties {

    private double defaultFontSize = 24d;

    private float pageMargin = 36f;

    private PageFormat defaultPageFormat = PageFormat.A4;

    private String pdfVersion = "1.7";

    private long maxFontBytes = 20L * 1024 * 1024;

    public double getDefaultFontSize() {
        return defaultFontSize;
    }

    public void setDefaultFontSize(double defaultFontSize) {
        this.defaultFontSize = defaultFontSize;
    }

    public float getPageMargin() {
        return pageMargin;
    }

    public void setPageMargin(float pageMargin) {
        this.pageMargin = pageMargin;
    }

    public PageFormat getDefaultPageFormat() {
        return defaultPageFormat;
    }

    public void setDefaultPageFormat(PageFormat defaultPageFormat) {
        this.defaultPageFormat = defaultPageFormat;
    }

    public String getPdfVersion() {
        return pdfVersion;
    }

    public void setPdfVersion(String pdfVersion) {
        this.pdfVersion = pdfVersion;
    }

    public long getMaxFontBytes() {
        return maxFontBytes;
    }

    public void setMaxFontBytes(long maxFontBytes) {
        this.maxFontBytes = maxFontBytes;
    }
}
