package com.example.rentalrepairs.repository.jpa;

import com.example.rentalrepairs.exception.AggregateNotFoundException;
import com.example.rentalrepairs.exception.ConcurrencyConflictException;
import com.example.rentalrepairs.repository.AggregateRepository;
import com.example.rentalrepairs.specification.JpaSpecificationTranslator;
import com.example.rentalrepairs.specification.Specification;
import com.example.rentalrepairs.specification.TranslatedQuery;
import jakarta.persistence.EntityManager;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * {@link AggregateRepository} on top of a Spring Data repository. Specifications are translated
 * before anything is sent to the database, so an untranslatable one never starts a query.
 */
public abstract class JpaAggregateRepository<T, R extends JpaRepository<T, UUID> & JpaSpecificationExecutor<T>>
        implements AggregateRepository<T> {

    protected final R jpaRepository;

    private final String aggregateType;
    private final Function<T, UUID> idAccessor;
    private final JpaSpecificationTranslator<T> translator;

    protected JpaAggregateRepository(Class<T> entityType, Function<T, UUID> idAccessor, R jpaRepository,
                                     EntityManager entityManager) {
        this.jpaRepository = jpaRepository;
        this.aggregateType = entityType.getSimpleName();
        this.idAccessor = idAccessor;
        this.translator = new JpaSpecificationTranslator<>(entityType, entityManager.getMetamodel());
    }

    @Override
    public T get(UUID id) {
        return jpaRepository.findById(id).orElseThrow(() -> new AggregateNotFoundException(aggregateType, id));
    }

    @Override
    public Optional<T> findById(UUID id) {
        return jpaRepository.findById(id);
    }

    /**
     * Inserts immediately, so unique-key clashes surface here as
     * {@link org.springframework.dao.DataIntegrityViolationException} rather than at commit.
     */
    @Override
    public T add(T aggregate) {
        return jpaRepository.saveAndFlush(aggregate);
    }

    @Override
    public T update(T aggregate) {
        try {
            return jpaRepository.saveAndFlush(aggregate);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(aggregateType, idAccessor.apply(aggregate), e);
        }
    }

    @Override
    public List<T> find(Specification<T> specification) {
        TranslatedQuery<T> query = translator.translate(specification);
        return jpaRepository.findAll(query.filter(), query.sort());
    }

    @Override
    public long count(Specification<T> specification) {
        TranslatedQuery<T> query = translator.translate(specification);
        return jpaRepository.count(query.filter());
    }
}
