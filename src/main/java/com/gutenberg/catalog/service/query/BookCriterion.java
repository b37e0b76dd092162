package com.gutenberg.catalog.service.query;

import com.gutenberg.catalog.entity.Book;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;

/**
 * One compiled filter.
 *
 * @param name              query parameter the criterion came from
 * @param values            parsed values, kept for logging
 * @param specification     predicate applied to the book query
 * @param traversesRelation whether the predicate reaches through a to-many relation
 *                          (and is therefore compiled as a distinct identity semi-join)
 */
public record BookCriterion(
    String name,
    List<?> values,
    Specification<Book> specification,
    boolean traversesRelation
) {
    public BookCriterion {
        values = List.copyOf(values);
    }

    public String describe() {
        return name + "=" + values;
    }
}
