package com.gutenberg.catalog.mapper;

import com.gutenberg.catalog.dto.response.BookResponse;
import com.gutenberg.catalog.entity.Author;
import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.entity.Bookshelf;
import com.gutenberg.catalog.entity.Format;
import com.gutenberg.catalog.entity.Language;
import com.gutenberg.catalog.entity.Subject;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

public final class BookMapper {

    private BookMapper() {}

    public static BookResponse toResponse(Book book) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getGutenbergId(),
            book.getDownloadCount(),
            project(book.getAuthors(), Author::getId, BookMapper::toAuthorSummary),
            project(book.getLanguages(), Language::getId,
                language -> new BookResponse.LanguageSummary(language.getCode())),
            project(book.getSubjects(), Subject::getId,
                subject -> new BookResponse.SubjectSummary(subject.getName())),
            project(book.getBookshelves(), Bookshelf::getId,
                bookshelf -> new BookResponse.BookshelfSummary(bookshelf.getName())),
            project(book.getFormats(), Format::getId,
                format -> new BookResponse.FormatSummary(format.getMimeType(), format.getUrl()))
        );
    }

    private static BookResponse.AuthorSummary toAuthorSummary(Author author) {
        return new BookResponse.AuthorSummary(
            author.getName(),
            author.getBirthYear() != null ? author.getBirthYear().intValue() : null,
            author.getDeathYear() != null ? author.getDeathYear().intValue() : null
        );
    }

    // Associations are unordered sets; emit them in id order so responses are repeatable.
    private static <E, R> List<R> project(Collection<E> items, Function<E, Integer> id,
                                          Function<E, R> mapper) {
        if (items == null) {
            return Collections.emptyList();
        }
        return items.stream()
            .sorted(Comparator.comparing(id, Comparator.nullsLast(Comparator.naturalOrder())))
            .map(mapper)
            .toList();
    }
}
