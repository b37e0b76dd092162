package com.gutenberg.catalog.service.query;

import com.gutenberg.catalog.entity.Book;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;

/**
 * Composed, not yet executed book query: the active criteria plus the result ordering.
 */
public record BookQuery(List<BookCriterion> criteria, BookOrdering ordering) {

    public BookQuery {
        criteria = List.copyOf(criteria);
    }

    /**
     * All criteria folded with AND. With no criteria the specification yields no
     * predicate and matches every book.
     */
    public Specification<Book> specification() {
        return Specification.allOf(criteria.stream()
            .map(BookCriterion::specification)
            .toList());
    }

    public boolean isUnfiltered() {
        return criteria.isEmpty();
    }

    public List<String> appliedFilters() {
        return criteria.stream().map(BookCriterion::describe).toList();
    }
}
