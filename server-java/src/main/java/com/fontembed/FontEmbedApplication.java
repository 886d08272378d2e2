package com.fontembed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FontEmbedApplication {

    public static void main(String[] args) {
        SpringApplication.run(FontEmbedApplication.class, args);
    }
}
