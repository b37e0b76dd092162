package com.gutenberg.catalog.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BookResponse(
    Integer id,
    String title,
    @JsonProperty("gutenberg_id") Integer gutenbergId,
    @JsonProperty("download_count") Integer downloadCount,
    List<AuthorSummary> authors,
    List<LanguageSummary> languages,
    List<SubjectSummary> subjects,
    List<BookshelfSummary> bookshelves,
    List<FormatSummary> formats
) {
    public record AuthorSummary(
        String name,
        @JsonProperty("birth_year") Integer birthYear,
        @JsonProperty("death_year") Integer deathYear
    ) {}

    public record LanguageSummary(String code) {}

    public record SubjectSummary(String name) {}

    public record BookshelfSummary(String name) {}

    public record FormatSummary(@JsonProperty("mime_type") String mimeType, String url) {}
}
