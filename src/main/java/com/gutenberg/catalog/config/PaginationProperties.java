package com.gutenberg.catalog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Page size limits for the book list endpoint.
 */
@Component
@ConfigurationProperties(prefix = "catalog.pagination")
@Getter
@Setter
public class PaginationProperties {

    /**
     * Page size used when the request has no valid {@code page_size}.
     */
    private int defaultPageSize = 25;

    /**
     * Upper bound for {@code page_size}; larger requests are clamped to it.
     */
    private int maxPageSize = 100;
}
