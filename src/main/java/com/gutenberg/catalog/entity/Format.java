package com.gutenberg.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

/**
 * A downloadable rendition of a {@link Book}: a MIME type plus the URL serving it.
 * Owning side of {@link Book#getFormats()}.
 */
@Entity
@Immutable
@Table(name = "books_format")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class Format {

    @Id
    private Integer id;

    @Column(name = "mime_type", nullable = false, columnDefinition = "TEXT")
    private String mimeType;

    @Column(name = "url", nullable = false, columnDefinition = "TEXT")
    private String url;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false)
    private Book book;
}
