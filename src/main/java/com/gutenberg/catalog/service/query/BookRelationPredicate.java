package com.gutenberg.catalog.service.query;

import com.gutenberg.catalog.entity.Book;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Predicate over a book and the rows reachable through one of its to-many relations.
 * Joins made from {@code book} may multiply rows, so a relation predicate is never used
 * directly as a filter; {@link BookSpecifications#distinctBookIds} wraps it first.
 */
@FunctionalInterface
public interface BookRelationPredicate {

    Predicate toPredicate(Root<Book> book, CriteriaBuilder cb);
}
