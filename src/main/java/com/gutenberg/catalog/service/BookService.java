package com.gutenberg.catalog.service;

import com.gutenberg.catalog.dto.response.BookListResponse;
import com.gutenberg.catalog.dto.response.BookResponse;
import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.exception.ResourceNotFoundException;
import com.gutenberg.catalog.mapper.BookMapper;
import com.gutenberg.catalog.repository.BookRepository;
import com.gutenberg.catalog.service.event.CatalogQueryEvents;
import com.gutenberg.catalog.service.query.BookFilterParser;
import com.gutenberg.catalog.service.query.BookListRequest;
import com.gutenberg.catalog.service.query.BookQuery;
import com.gutenberg.catalog.service.query.BookQueryComposer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class BookService {

    private final BookRepository bookRepository;
    private final BookFilterParser filterParser;
    private final BookQueryComposer queryComposer;
    private final BookPaginator paginator;
    private final BookResponseAssembler responseAssembler;
    private final CatalogQueryEvents queryEvents;

    @Transactional(readOnly = true)
    public BookListResponse findAll(Map<String, String> params, UriComponentsBuilder requestUri) {
        BookListRequest request = filterParser.parse(params);
        BookQuery query = queryComposer.compose(request.filter());
        queryEvents.queryComposed(query);

        BookPage page = paginator.paginate(query, request.page());
        BookListResponse response = responseAssembler.assemble(page, requestUri);

        queryEvents.pageServed(request.page(), response.count(), response.countTotal());
        return response;
    }

    @Transactional(readOnly = true)
    public BookResponse findById(Integer id) {
        Book book = bookRepository.findByIdWithAuthors(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        queryEvents.bookRetrieved(book);
        return BookMapper.toResponse(book);
    }
}
