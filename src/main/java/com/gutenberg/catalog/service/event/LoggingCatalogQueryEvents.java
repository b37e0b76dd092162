package com.gutenberg.catalog.service.event;

import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.service.query.BookCriterion;
import com.gutenberg.catalog.service.query.BookQuery;
import com.gutenberg.catalog.service.query.PageSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingCatalogQueryEvents implements CatalogQueryEvents {

    private static final Logger log = LoggerFactory.getLogger(LoggingCatalogQueryEvents.class);

    @Override
    public void queryComposed(BookQuery query) {
        if (query.isUnfiltered()) {
            log.info("No filters applied");
            return;
        }
        if (log.isDebugEnabled()) {
            for (BookCriterion criterion : query.criteria()) {
                log.debug("Applied {} filter: {} (relation: {})",
                    criterion.name(), criterion.values(), criterion.traversesRelation());
            }
        }
        log.info("Applied filters: {}", String.join(", ", query.appliedFilters()));
    }

    @Override
    public void pageServed(PageSelection selection, int count, long total) {
        log.info("Returned page {} (size {}) with {} results out of {} total matches",
            selection.page(), selection.pageSize(), count, total);
    }

    @Override
    public void bookRetrieved(Book book) {
        log.info("Retrieved book '{}' (ID: {}, Gutenberg ID: {})",
            book.getTitle() != null ? book.getTitle() : "Book " + book.getId(),
            book.getId(), book.getGutenbergId());
    }
}
