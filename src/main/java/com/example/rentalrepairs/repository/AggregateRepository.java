package com.example.rentalrepairs.repository;

import com.example.rentalrepairs.exception.AggregateNotFoundException;
import com.example.rentalrepairs.exception.ConcurrencyConflictException;
import com.example.rentalrepairs.specification.Specification;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract shared by every aggregate. The domain only talks to this shape; the
 * store behind it is an adapter concern.
 */
public interface AggregateRepository<T> {

    /**
     * @throws AggregateNotFoundException when nothing is stored under the id
     */
    T get(UUID id);

    Optional<T> findById(UUID id);

    T add(T aggregate);

    /**
     * Writes the aggregate and checks its version.
     *
     * @throws ConcurrencyConflictException when the stored version moved on since the aggregate was read
     */
    T update(T aggregate);

    List<T> find(Specification<T> specification);

    long count(Specification<T> specification);
}
