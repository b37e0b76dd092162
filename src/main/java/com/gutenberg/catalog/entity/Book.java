package com.gutenberg.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.Immutable;

import java.util.HashSet;
import java.util.Set;

/**
 * JPA entity representing a work in the Project Gutenberg catalog.
 *
 * <p><strong>Read-only</strong>: catalog rows are batch-loaded outside this service.
 * {@link Immutable} makes Hibernate skip dirty checking for loaded instances and
 * reject any attempt to flush changes back to {@code books_book}.
 *
 * <p><strong>Association ownership</strong>: Book owns all four junction tables
 * ({@code books_book_authors}, {@code books_book_languages}, {@code books_book_subjects},
 * {@code books_book_bookshelves}). The inverse sides are not mapped because nothing
 * navigates from a tag back to its books; filters reach the junctions through
 * criteria joins rooted at Book.
 *
 * <p><strong>Fetch strategy</strong>: every collection is {@code LAZY} with
 * {@code @BatchSize(size = 100)}. A list page holds at most 100 books, so projecting
 * a full page initialises each collection type with a single IN-clause query
 * instead of one query per book.
 *
 * <p><strong>Lombok notes</strong>: equality is based on {@code id} only. No
 * {@code @ToString}, which would walk the lazy collections.
 */
@Entity
@Immutable
@Table(name = "books_book")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class Book {

    @Id
    private Integer id;

    /**
     * Project Gutenberg ebook number. Not unique in the store; used only as a filter key.
     */
    @Column(name = "gutenberg_id", nullable = false)
    private Integer gutenbergId;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    /** Popularity signal and default sort key. Null for books without statistics. */
    @Column(name = "download_count")
    private Integer downloadCount;

    @Column(name = "media_type", nullable = false, columnDefinition = "TEXT")
    private String mediaType;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "books_book_authors",
            joinColumns = @JoinColumn(name = "book_id"),
            inverseJoinColumns = @JoinColumn(name = "author_id")
    )
    @BatchSize(size = 100)
    private Set<Author> authors = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "books_book_languages",
            joinColumns = @JoinColumn(name = "book_id"),
            inverseJoinColumns = @JoinColumn(name = "language_id")
    )
    @BatchSize(size = 100)
    private Set<Language> languages = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "books_book_subjects",
            joinColumns = @JoinColumn(name = "book_id"),
            inverseJoinColumns = @JoinColumn(name = "subject_id")
    )
    @BatchSize(size = 100)
    private Set<Subject> subjects = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "books_book_bookshelves",
            joinColumns = @JoinColumn(name = "book_id"),
            inverseJoinColumns = @JoinColumn(name = "bookshelf_id")
    )
    @BatchSize(size = 100)
    private Set<Bookshelf> bookshelves = new HashSet<>();

    /**
     * Download formats. Exclusively owned by this book through {@code books_format.book_id}.
     */
    @OneToMany(mappedBy = "book", fetch = FetchType.LAZY)
    @BatchSize(size = 100)
    private Set<Format> formats = new HashSet<>();
}
