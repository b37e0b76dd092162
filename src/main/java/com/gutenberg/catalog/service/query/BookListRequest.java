package com.gutenberg.catalog.service.query;

public record BookListRequest(BookFilter filter, PageSelection page) {}
