package com.gutenberg.catalog.service.event;

import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.service.query.BookQuery;
import com.gutenberg.catalog.service.query.PageSelection;

/**
 * Observability hooks for catalog reads. Injected into {@link com.gutenberg.catalog.service.BookService}
 * so the query path itself holds no logger state and can be verified with a mock.
 */
public interface CatalogQueryEvents {

    void queryComposed(BookQuery query);

    void pageServed(PageSelection selection, int count, long total);

    void bookRetrieved(Book book);
}
