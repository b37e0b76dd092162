package com.gutenberg.catalog.controller;

import com.gutenberg.catalog.dto.response.BookListResponse;
import com.gutenberg.catalog.dto.response.BookResponse;
import com.gutenberg.catalog.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.Map;

@RestController
@RequestMapping("/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Project Gutenberg catalog, read-only")
public class BookController {

    private final BookService bookService;

    @GetMapping({"", "/"})
    @Operation(summary = "List books", description = "Returns books in decreasing order of popularity (download count). "
        + "Every filter accepts a comma-separated list; values within a filter are ORed, filters are ANDed. "
        + "Malformed values are ignored rather than rejected.")
    @ApiResponse(responseCode = "200", description = "Page of matching books")
    @Parameter(name = "gutenberg_id", in = ParameterIn.QUERY, example = "1342,84,11",
        description = "Filter by Gutenberg IDs (comma-separated)")
    @Parameter(name = "language", in = ParameterIn.QUERY, example = "en,fr",
        description = "Filter by language codes (comma-separated)")
    @Parameter(name = "topic", in = ParameterIn.QUERY, example = "child,adventure",
        description = "Case-insensitive partial match on subject or bookshelf names (comma-separated). "
            + "\"child\" matches the bookshelf \"Children's literature\" and the subject \"Child education\".")
    @Parameter(name = "mime_type", in = ParameterIn.QUERY, example = "text/html,application/epub+zip",
        description = "Filter by MIME types of available formats (comma-separated)")
    @Parameter(name = "author", in = ParameterIn.QUERY, example = "twain,dickens",
        description = "Case-insensitive partial match on author names (comma-separated)")
    @Parameter(name = "title", in = ParameterIn.QUERY, example = "pride,adventure",
        description = "Case-insensitive partial match on titles (comma-separated)")
    @Parameter(name = "page", in = ParameterIn.QUERY, schema = @Schema(type = "integer", defaultValue = "1"),
        description = "Page number, starting at 1")
    @Parameter(name = "page_size", in = ParameterIn.QUERY,
        schema = @Schema(type = "integer", defaultValue = "25", maximum = "100"),
        description = "Results per page (max 100)")
    public ResponseEntity<BookListResponse> findAll(@Parameter(hidden = true) @RequestParam Map<String, String> params) {
        return ResponseEntity.ok(bookService.findAll(params, ServletUriComponentsBuilder.fromCurrentRequest()));
    }

    @GetMapping({"/{id:\\d+}", "/{id:\\d+}/"})
    @Operation(summary = "Get book by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable Integer id) {
        return ResponseEntity.ok(bookService.findById(id));
    }
}
