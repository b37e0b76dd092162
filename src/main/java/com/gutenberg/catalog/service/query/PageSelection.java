package com.gutenberg.catalog.service.query;

/**
 * One-based page number and page size, both already validated by {@link BookFilterParser}.
 */
public record PageSelection(int page, int pageSize) {

    public PageSelection {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be 1 or greater, got " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be 1 or greater, got " + pageSize);
        }
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
