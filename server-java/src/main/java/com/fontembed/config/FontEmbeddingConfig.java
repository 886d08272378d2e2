package com.fontembed.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
@EnableConfigurationProperties(FontEmbeddingProperties.class)
public class FontEmbeddingConfig {

    /**
     * Источник случайных суффиксов для BaseFont.
     */
    @Bean
    public Random fontNameRandom() {
        return new SecureRandom();
    }
}
