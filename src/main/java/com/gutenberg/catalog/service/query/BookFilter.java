package com.gutenberg.catalog.service.query;

import java.util.List;

/**
 * Typed, validated filter set for the book list endpoint.
 *
 * <p>An empty list means the filter is absent. Values inside one list are alternatives
 * (OR); non-empty lists are combined with each other by AND.
 */
public record BookFilter(
    List<Integer> gutenbergIds,
    List<String> languages,
    List<String> topics,
    List<String> mimeTypes,
    List<String> authors,
    List<String> titles
) {
    public BookFilter {
        gutenbergIds = gutenbergIds == null ? List.of() : List.copyOf(gutenbergIds);
        languages = languages == null ? List.of() : List.copyOf(languages);
        topics = topics == null ? List.of() : List.copyOf(topics);
        mimeTypes = mimeTypes == null ? List.of() : List.copyOf(mimeTypes);
        authors = authors == null ? List.of() : List.copyOf(authors);
        titles = titles == null ? List.of() : List.copyOf(titles);
    }

    public static BookFilter none() {
        return new BookFilter(null, null, null, null, null, null);
    }
}
