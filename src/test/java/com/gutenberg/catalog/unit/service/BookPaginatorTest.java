package com.gutenberg.catalog.unit.service;

import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.repository.BookRepository;
import com.gutenberg.catalog.service.BookPage;
import com.gutenberg.catalog.service.BookPaginator;
import com.gutenberg.catalog.service.query.BookFilter;
import com.gutenberg.catalog.service.query.BookQuery;
import com.gutenberg.catalog.service.query.BookQueryComposer;
import com.gutenberg.catalog.service.query.PageSelection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;
import java.util.stream.IntStream;

import static com.gutenberg.catalog.unit.BookFixtures.book;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookPaginatorTest {

    @Mock
    private BookRepository bookRepository;

    @InjectMocks
    private BookPaginator paginator;

    private final BookQuery query = new BookQueryComposer().compose(BookFilter.none());

    @Test
    void paginate_firstPageOfMany_hasNextButNoPrevious() {
        List<Book> firstPage = books(1, 25);
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(40L);
        when(bookRepository.findSlice(query, 0L, 25)).thenReturn(firstPage);

        BookPage page = paginator.paginate(query, new PageSelection(1, 25));

        assertThat(page.total()).isEqualTo(40L);
        assertThat(page.books()).hasSize(25);
        assertThat(page.hasNext()).isTrue();
        assertThat(page.hasPrevious()).isFalse();
    }

    @Test
    void paginate_lastPartialPage_hasPreviousButNoNext() {
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(40L);
        when(bookRepository.findSlice(query, 25L, 25)).thenReturn(books(26, 15));

        BookPage page = paginator.paginate(query, new PageSelection(2, 25));

        assertThat(page.books()).hasSize(15);
        assertThat(page.hasNext()).isFalse();
        assertThat(page.hasPrevious()).isTrue();
    }

    @Test
    void paginate_countsBeforeSlicing() {
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(3L);
        when(bookRepository.findSlice(query, 0L, 25)).thenReturn(books(1, 3));

        paginator.paginate(query, new PageSelection(1, 25));

        InOrder order = inOrder(bookRepository);
        order.verify(bookRepository).count(ArgumentMatchers.<Specification<Book>>any());
        order.verify(bookRepository).findSlice(eq(query), eq(0L), eq(25));
    }

    @Test
    void paginate_pageBeyondRange_returnsEmptySliceWithoutQuerying() {
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(40L);

        BookPage page = paginator.paginate(query, new PageSelection(5, 25));

        assertThat(page.books()).isEmpty();
        assertThat(page.total()).isEqualTo(40L);
        assertThat(page.hasNext()).isFalse();
        assertThat(page.hasPrevious()).isTrue();
        verify(bookRepository, never()).findSlice(eq(query), anyLong(), anyInt());
    }

    @Test
    void paginate_noMatches_returnsEmptyFirstPage() {
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(0L);

        BookPage page = paginator.paginate(query, new PageSelection(1, 25));

        assertThat(page.books()).isEmpty();
        assertThat(page.hasNext()).isFalse();
        assertThat(page.hasPrevious()).isFalse();
        verify(bookRepository, never()).findSlice(eq(query), anyLong(), anyInt());
    }

    @Test
    void paginate_exactMultipleOfPageSize_hasNoNextOnLastPage() {
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(50L);
        when(bookRepository.findSlice(query, 25L, 25)).thenReturn(books(26, 25));

        BookPage page = paginator.paginate(query, new PageSelection(2, 25));

        assertThat(page.hasNext()).isFalse();
    }

    private List<Book> books(int firstId, int count) {
        return IntStream.range(firstId, firstId + count)
            .mapToObj(id -> book(id, 1000 + id, "Book " + id, 500 - id))
            .toList();
    }
}
