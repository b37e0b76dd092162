package com.gutenberg.catalog.service.query;

import com.gutenberg.catalog.entity.Book;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.hibernate.query.criteria.HibernateCriteriaBuilder;
import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Criteria building blocks for {@link BookQueryComposer}.
 *
 * <p>Direct predicates ({@code gutenbergIdIn}, {@code titleContainsAny}) are plain
 * {@link Specification}s on {@code books_book}. Relation predicates join to-many
 * associations and are returned as {@link BookRelationPredicate}s so that the caller
 * has to decide how to collapse the join fan-out. {@code topicContainsAny} spans two
 * relations and comes back already collapsed.
 */
public final class BookSpecifications {

    static final char LIKE_ESCAPE = '\\';

    private BookSpecifications() {}

    public static Specification<Book> gutenbergIdIn(Collection<Integer> gutenbergIds) {
        return (root, query, cb) -> root.get("gutenbergId").in(gutenbergIds);
    }

    public static Specification<Book> titleContainsAny(Collection<String> tokens) {
        return (root, query, cb) -> containsAny(cb, root.<String>get("title"), tokens);
    }

    public static BookRelationPredicate languageCodeIn(Collection<String> codes) {
        return (book, cb) -> book.join("languages").get("code").in(codes);
    }

    /**
     * Books with a subject or a bookshelf containing any token. Each relation gets its own
     * semi-join so the two to-many joins never multiply each other.
     */
    public static Specification<Book> topicContainsAny(Collection<String> tokens) {
        return Specification.anyOf(
            distinctBookIds(subjectNameContainsAny(tokens)),
            distinctBookIds(bookshelfNameContainsAny(tokens))
        );
    }

    public static BookRelationPredicate subjectNameContainsAny(Collection<String> tokens) {
        return (book, cb) -> containsAny(cb, book.join("subjects").<String>get("name"), tokens);
    }

    public static BookRelationPredicate bookshelfNameContainsAny(Collection<String> tokens) {
        return (book, cb) -> containsAny(cb, book.join("bookshelves").<String>get("name"), tokens);
    }

    public static BookRelationPredicate mimeTypeIn(Collection<String> mimeTypes) {
        return (book, cb) -> book.join("formats").get("mimeType").in(mimeTypes);
    }

    public static BookRelationPredicate authorNameContainsAny(Collection<String> tokens) {
        return (book, cb) -> containsAny(cb, book.join("authors").<String>get("name"), tokens);
    }

    /**
     * Restricts the outer query to the set of distinct book ids satisfying {@code relation}:
     * {@code book.id IN (SELECT DISTINCT candidate.id FROM Book candidate JOIN ... WHERE ...)}.
     * The joins live only inside the subquery, so the outer row count (and therefore
     * the total count) is never inflated by matching related rows.
     */
    public static Specification<Book> distinctBookIds(BookRelationPredicate relation) {
        return (root, query, cb) -> {
            Subquery<Integer> matchingIds = query.subquery(Integer.class);
            Root<Book> candidate = matchingIds.from(Book.class);
            matchingIds.select(candidate.<Integer>get("id"))
                .distinct(true)
                .where(relation.toPredicate(candidate, cb));
            return root.get("id").in(matchingIds);
        };
    }

    /**
     * Most downloaded first. Books without a download count sort after every counted
     * book; ties are broken by id so page boundaries are stable. Matches the
     * {@code (download_count DESC NULLS LAST, id)} index.
     */
    public static BookOrdering byPopularity() {
        return (root, cb) -> {
            HibernateCriteriaBuilder hcb = (HibernateCriteriaBuilder) cb;
            return List.of(
                hcb.desc(root.get("downloadCount"), false),
                hcb.asc(root.get("id"))
            );
        };
    }

    static Predicate containsAny(CriteriaBuilder cb, Expression<String> field, Collection<String> tokens) {
        Expression<String> lowered = cb.lower(field);
        return cb.or(tokens.stream()
            .map(token -> cb.like(lowered, containsPattern(token), LIKE_ESCAPE))
            .toArray(Predicate[]::new));
    }

    static String containsPattern(String token) {
        StringBuilder pattern = new StringBuilder(token.length() + 2).append('%');
        for (char c : token.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }
}
