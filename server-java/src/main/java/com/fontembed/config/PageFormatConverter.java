package com.fontembed.config;

import com.fontembed.model.PageFormat;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

@Component
public class PageFormatConverter implements Converter<String, PageFormat> {

    @Override
    public PageFormat convert(String source) {
        return source == null ? null : PageFormat.from(source);
    }
}
