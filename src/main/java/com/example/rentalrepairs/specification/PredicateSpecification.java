package com.example.rentalrepairs.specification;

import java.util.Objects;
import java.util.function.Predicate;

public final class PredicateSpecification<T> extends Specification<T> {

    private final String description;
    private final Predicate<T> predicate;

    PredicateSpecification(String description, Predicate<T> predicate, QueryShape shape) {
        super(shape);
        this.description = Objects.requireNonNull(description, "description");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return predicate.test(candidate);
    }

    @Override
    public <R> R accept(SpecificationVisitor<T, R> visitor) {
        return visitor.visitPredicate(this);
    }

    @Override
    protected Specification<T> withShape(QueryShape shape) {
        return new PredicateSpecification<>(description, predicate, shape);
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "where(" + description + ")";
    }
}
