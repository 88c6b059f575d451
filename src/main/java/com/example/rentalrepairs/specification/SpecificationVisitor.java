package com.example.rentalrepairs.specification;

public interface SpecificationVisitor<T, R> {

    R visitAttribute(AttributeSpecification<T, ?> specification);

    R visitPredicate(PredicateSpecification<T> specification);

    R visitAnd(AndSpecification<T> specification);

    R visitOr(OrSpecification<T> specification);

    R visitNot(NotSpecification<T> specification);
}
