package com.gutenberg.catalog.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Paginated book list envelope. {@code next} and {@code previous} are absolute links,
 * or {@code null} when there is no such page.
 */
public record BookListResponse(
    int count,
    @JsonProperty("count_total") long countTotal,
    String next,
    String previous,
    List<BookResponse> results
) {}
