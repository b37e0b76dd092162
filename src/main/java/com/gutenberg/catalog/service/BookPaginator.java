package com.gutenberg.catalog.service;

import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.repository.BookRepository;
import com.gutenberg.catalog.service.query.BookQuery;
import com.gutenberg.catalog.service.query.PageSelection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Executes a {@link BookQuery} for one page.
 *
 * <p>The count runs first, over the same deduplicated specification as the slice. A
 * page starting at or beyond the total is answered with an empty slice and no second
 * query. Callers provide the transaction so count and slice share one connection.
 */
@Component
@RequiredArgsConstructor
public class BookPaginator {

    private final BookRepository bookRepository;

    public BookPage paginate(BookQuery query, PageSelection selection) {
        long total = bookRepository.count(query.specification());

        List<Book> books = selection.offset() < total
            ? bookRepository.findSlice(query, selection.offset(), selection.pageSize())
            : List.of();

        return new BookPage(books, total, selection);
    }
}
