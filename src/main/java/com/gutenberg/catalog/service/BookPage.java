package com.gutenberg.catalog.service;

import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.service.query.PageSelection;

import java.util.List;

/**
 * One page of matching books plus the total number of matches across all pages.
 */
public record BookPage(List<Book> books, long total, PageSelection selection) {

    public BookPage {
        books = List.copyOf(books);
    }

    public boolean hasNext() {
        return (long) selection.page() * selection.pageSize() < total;
    }

    public boolean hasPrevious() {
        return selection.page() > 1;
    }
}
