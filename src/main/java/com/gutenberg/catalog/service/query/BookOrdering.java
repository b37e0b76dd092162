package com.gutenberg.catalog.service.query;

import com.gutenberg.catalog.entity.Book;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;

import java.util.List;

@FunctionalInterface
public interface BookOrdering {

    List<Order> toOrders(Root<Book> root, CriteriaBuilder cb);
}
