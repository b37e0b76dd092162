package com.gutenberg.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

/**
 * JPA entity representing a writer in the Project Gutenberg catalog.
 *
 * <p>Birth and death years are stored as {@code SMALLINT} and are frequently unknown,
 * hence the nullable {@link Short} fields. Author is reachable only through
 * {@link Book#getAuthors()}.
 */
@Entity
@Immutable
@Table(name = "books_author")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class Author {

    @Id
    private Integer id;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(name = "birth_year")
    private Short birthYear;

    @Column(name = "death_year")
    private Short deathYear;
}
