package com.gutenberg.catalog.unit.service;

import com.gutenberg.catalog.config.PaginationProperties;
import com.gutenberg.catalog.dto.response.BookListResponse;
import com.gutenberg.catalog.dto.response.BookResponse;
import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.exception.ResourceNotFoundException;
import com.gutenberg.catalog.repository.BookRepository;
import com.gutenberg.catalog.service.BookPaginator;
import com.gutenberg.catalog.service.BookResponseAssembler;
import com.gutenberg.catalog.service.BookService;
import com.gutenberg.catalog.service.event.CatalogQueryEvents;
import com.gutenberg.catalog.service.query.BookFilterParser;
import com.gutenberg.catalog.service.query.BookQuery;
import com.gutenberg.catalog.service.query.BookQueryComposer;
import com.gutenberg.catalog.service.query.PageSelection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.gutenberg.catalog.unit.BookFixtures.author;
import static com.gutenberg.catalog.unit.BookFixtures.book;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookServiceTest {

    @Mock
    private BookRepository bookRepository;

    @Mock
    private CatalogQueryEvents queryEvents;

    private BookService bookService;

    @BeforeEach
    void setUp() {
        bookService = new BookService(
            bookRepository,
            new BookFilterParser(new PaginationProperties()),
            new BookQueryComposer(),
            new BookPaginator(bookRepository),
            new BookResponseAssembler(),
            queryEvents);
    }

    @Test
    void findAll_withFilters_returnsEnvelopeAndReportsQuery() {
        Book huck = book(1, 76, "Adventures of Huckleberry Finn", 20000);
        huck.getAuthors().add(author(10, "Twain, Mark", 1835, 1910));
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(1L);
        when(bookRepository.findSlice(any(BookQuery.class), eq(0L), eq(25))).thenReturn(List.of(huck));

        BookListResponse response = bookService.findAll(
            Map.of("author", "twain", "language", "en"),
            UriComponentsBuilder.fromUriString("http://localhost/books?author=twain&language=en"));

        assertThat(response.count()).isEqualTo(1);
        assertThat(response.countTotal()).isEqualTo(1L);
        assertThat(response.next()).isNull();
        assertThat(response.previous()).isNull();
        assertThat(response.results()).extracting(BookResponse::gutenbergId).containsExactly(76);

        ArgumentCaptor<BookQuery> query = ArgumentCaptor.forClass(BookQuery.class);
        verify(queryEvents).queryComposed(query.capture());
        assertThat(query.getValue().appliedFilters()).containsExactly("language=[en]", "author=[twain]");
        verify(queryEvents).pageServed(new PageSelection(1, 25), 1, 1L);
    }

    @Test
    void findAll_requestedPageSize_isPassedToSlice() {
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(40L);
        when(bookRepository.findSlice(any(BookQuery.class), eq(10L), eq(5))).thenReturn(List.of());

        BookListResponse response = bookService.findAll(
            Map.of("page", "3", "page_size", "5"),
            UriComponentsBuilder.fromUriString("http://localhost/books?page=3&page_size=5"));

        assertThat(response.next()).isEqualTo("http://localhost/books?page_size=5&page=4");
        assertThat(response.previous()).isEqualTo("http://localhost/books?page_size=5&page=2");
    }

    @Test
    void findAll_pageBeyondRange_skipsSliceQuery() {
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any())).thenReturn(2L);

        BookListResponse response = bookService.findAll(Map.of("page", "4"),
            UriComponentsBuilder.fromUriString("http://localhost/books?page=4"));

        assertThat(response.results()).isEmpty();
        assertThat(response.countTotal()).isEqualTo(2L);
        verify(bookRepository, never()).findSlice(any(BookQuery.class), anyLong(), anyInt());
    }

    @Test
    void findAll_storeFailure_propagates() {
        when(bookRepository.count(ArgumentMatchers.<Specification<Book>>any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> bookService.findAll(Map.of(),
                UriComponentsBuilder.fromUriString("http://localhost/books")))
            .isInstanceOf(DataAccessResourceFailureException.class);
        verify(queryEvents, never()).pageServed(any(), anyInt(), anyLong());
    }

    @Test
    void findById_whenExists_returnsBookResponse() {
        Book book = book(5, 1342, "Pride and Prejudice", 5000);
        when(bookRepository.findByIdWithAuthors(5)).thenReturn(Optional.of(book));

        BookResponse response = bookService.findById(5);

        assertThat(response.id()).isEqualTo(5);
        assertThat(response.title()).isEqualTo("Pride and Prejudice");
        verify(queryEvents).bookRetrieved(book);
    }

    @Test
    void findById_whenNotFound_throwsException() {
        when(bookRepository.findByIdWithAuthors(99)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookService.findById(99))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Book not found with id 99");
        verify(queryEvents, never()).bookRetrieved(any());
    }
}
