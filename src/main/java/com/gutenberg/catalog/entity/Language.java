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
 * Language a book is available in, identified by a lowercase code such as {@code en}.
 */
@Entity
@Immutable
@Table(name = "books_language")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class Language {

    @Id
    private Integer id;

    @Column(name = "code", nullable = false, columnDefinition = "TEXT")
    private String code;
}
