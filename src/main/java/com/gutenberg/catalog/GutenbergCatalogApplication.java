package com.gutenberg.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GutenbergCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(GutenbergCatalogApplication.class, args);
    }
}
