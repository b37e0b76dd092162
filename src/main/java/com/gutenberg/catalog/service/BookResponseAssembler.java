package com.gutenberg.catalog.service;

import com.gutenberg.catalog.dto.response.BookListResponse;
import com.gutenberg.catalog.dto.response.BookResponse;
import com.gutenberg.catalog.mapper.BookMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

import static com.gutenberg.catalog.service.query.BookFilterParser.PAGE;

/**
 * Wraps a {@link BookPage} into the list envelope.
 *
 * <p>Page links are derived from the URL of the current request, so every filter and
 * {@code page_size} the client sent is carried over verbatim. Only {@code page} changes;
 * the link to the first page drops it.
 */
@Component
public class BookResponseAssembler {

    public BookListResponse assemble(BookPage page, UriComponentsBuilder requestUri) {
        List<BookResponse> results = page.books().stream()
            .map(BookMapper::toResponse)
            .toList();

        int current = page.selection().page();
        String next = page.hasNext() ? pageLink(requestUri, current + 1) : null;
        String previous = page.hasPrevious() ? pageLink(requestUri, current - 1) : null;

        return new BookListResponse(results.size(), page.total(), next, previous, results);
    }

    private String pageLink(UriComponentsBuilder requestUri, int page) {
        UriComponentsBuilder link = requestUri.cloneBuilder();
        if (page == 1) {
            link.replaceQueryParam(PAGE);
        } else {
            link.replaceQueryParam(PAGE, page);
        }
        return link.build().toUriString();
    }
}
