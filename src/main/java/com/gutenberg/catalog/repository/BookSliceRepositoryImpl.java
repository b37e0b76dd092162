package com.gutenberg.catalog.repository;

import com.gutenberg.catalog.entity.Book;
import com.gutenberg.catalog.service.query.BookQuery;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class BookSliceRepositoryImpl implements BookSliceRepository {

    private final EntityManager entityManager;

    @Override
    public List<Book> findSlice(BookQuery query, long offset, int limit) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Book> criteria = cb.createQuery(Book.class);
        Root<Book> root = criteria.from(Book.class);

        Predicate predicate = query.specification().toPredicate(root, criteria, cb);
        criteria.select(root);
        if (predicate != null) {
            criteria.where(predicate);
        }
        criteria.orderBy(query.ordering().toOrders(root, cb));

        return entityManager.createQuery(criteria)
            .setFirstResult(Math.toIntExact(offset))
            .setMaxResults(limit)
            .getResultList();
    }
}
