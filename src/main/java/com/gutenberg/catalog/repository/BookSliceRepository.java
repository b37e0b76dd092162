package com.gutenberg.catalog.repository;

import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.service.query.BookQuery;

import java.util.List;

/**
 * Fetches one window of a composed {@link BookQuery} in the query's own ordering.
 *
 * <p>Kept separate from {@code findAll(Specification, Pageable)} because that method
 * also runs a count and only supports property sorts, while the catalog ordering puts
 * null download counts last.
 */
public interface BookSliceRepository {

    List<Book> findSlice(BookQuery query, long offset, int limit);
}
