package com.gutenberg.catalog.unit;

import com.gutenberg.catalog.entity.Author;
import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.entity.Bookshelf;
import com.gutenberg.catalog.entity.Format;
import com.gutenberg.catalog.entity.Language;
import com.gutenberg.catalog.entity.Subject;

public final class BookFixtures {

    private BookFixtures() {}

    public static Book book(Integer id, int gutenbergId, String title, Integer downloadCount) {
        Book book = new Book();
        book.setId(id);
        book.setGutenbergId(gutenbergId);
        book.setTitle(title);
        book.setDownloadCount(downloadCount);
        book.setMediaType("Text");
        return book;
    }

    public static Author author(Integer id, String name, Integer birthYear, Integer deathYear) {
        Author author = new Author();
        author.setId(id);
        author.setName(name);
        author.setBirthYear(birthYear != null ? birthYear.shortValue() : null);
        author.setDeathYear(deathYear != null ? deathYear.shortValue() : null);
        return author;
    }

    public static Language language(Integer id, String code) {
        Language language = new Language();
        language.setId(id);
        language.setCode(code);
        return language;
    }

    public static Subject subject(Integer id, String name) {
        Subject subject = new Subject();
        subject.setId(id);
        subject.setName(name);
        return subject;
    }

    public static Bookshelf bookshelf(Integer id, String name) {
        Bookshelf bookshelf = new Bookshelf();
        bookshelf.setId(id);
        bookshelf.setName(name);
        return bookshelf;
    }

    public static Format format(Integer id, Book book, String mimeType, String url) {
        Format format = new Format();
        format.setId(id);
        format.setBook(book);
        format.setMimeType(mimeType);
        format.setUrl(url);
        book.getFormats().add(format);
        return format;
    }
}
