package com.gutenberg.catalog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI catalogOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Gutenberg Catalog API")
                .description("Read-only API for the Project Gutenberg book catalog. "
                    + "Books are listed in decreasing order of popularity (download count) "
                    + "and can be filtered by Gutenberg id, language, topic, MIME type, author and title.")
                .version("1.0.0")
                .license(new License().name("BSD License")));
    }
}
