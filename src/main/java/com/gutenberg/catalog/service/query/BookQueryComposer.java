package com.gutenberg.catalog.service.query;

import com.gutenberg.catalog.entity.Book;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.gutenberg.catalog.service.query.BookFilterParser.AUTHOR;
import static com.gutenberg.catalog.service.query.BookFilterParser.GUTENBERG_ID;
import static com.gutenberg.catalog.service.query.BookFilterParser.LANGUAGE;
import static com.gutenberg.catalog.service.query.BookFilterParser.MIME_TYPE;
import static com.gutenberg.catalog.service.query.BookFilterParser.TITLE;
import static com.gutenberg.catalog.service.query.BookFilterParser.TOPIC;

/**
 * Builds a {@link BookQuery} from a {@link BookFilter}. Pure: no I/O, no shared state.
 *
 * <p>Each non-empty filter becomes one {@link BookCriterion}; the criteria are ANDed by
 * {@link BookQuery#specification()}. Filters over to-many relations (language, topic,
 * MIME type, author) are wrapped in {@link BookSpecifications#distinctBookIds} so every
 * book appears at most once however many related rows it matches through.
 */
@Component
public class BookQueryComposer {

    public BookQuery compose(BookFilter filter) {
        List<BookCriterion> criteria = new ArrayList<>();

        if (!filter.gutenbergIds().isEmpty()) {
            criteria.add(direct(GUTENBERG_ID, filter.gutenbergIds(),
                BookSpecifications.gutenbergIdIn(filter.gutenbergIds())));
        }
        if (!filter.languages().isEmpty()) {
            criteria.add(relation(LANGUAGE, filter.languages(),
                BookSpecifications.languageCodeIn(filter.languages())));
        }
        if (!filter.topics().isEmpty()) {
            criteria.add(new BookCriterion(TOPIC, filter.topics(),
                BookSpecifications.topicContainsAny(filter.topics()), true));
        }
        if (!filter.mimeTypes().isEmpty()) {
            criteria.add(relation(MIME_TYPE, filter.mimeTypes(),
                BookSpecifications.mimeTypeIn(filter.mimeTypes())));
        }
        if (!filter.authors().isEmpty()) {
            criteria.add(relation(AUTHOR, filter.authors(),
                BookSpecifications.authorNameContainsAny(filter.authors())));
        }
        if (!filter.titles().isEmpty()) {
            criteria.add(direct(TITLE, filter.titles(),
                BookSpecifications.titleContainsAny(filter.titles())));
        }

        return new BookQuery(criteria, BookSpecifications.byPopularity());
    }

    private static BookCriterion direct(String name, List<?> values, Specification<Book> specification) {
        return new BookCriterion(name, values, specification, false);
    }

    private static BookCriterion relation(String name, List<?> values, BookRelationPredicate predicate) {
        return new BookCriterion(name, values, BookSpecifications.distinctBookIds(predicate), true);
    }
}
