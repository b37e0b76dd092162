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
 * Curated Gutenberg collection such as "Children's Literature" or "Adventure".
 * Matched together with {@link Subject} under the "topic" filter.
 */
@Entity
@Immutable
@Table(name = "books_bookshelf")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class Bookshelf {

    @Id
    private Integer id;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;
}
