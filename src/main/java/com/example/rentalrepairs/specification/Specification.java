package com.example.rentalrepairs.specification;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A named, composable predicate over one aggregate type, plus the ordering and associations a
 * query built from it should use.
 *
 * <p>Specifications are immutable. {@link #and}, {@link #or} and {@link #not} build new trees;
 * {@link #isSatisfiedBy} evaluates the tree in memory with short-circuit semantics, and a store
 * adapter such as {@link JpaSpecificationTranslator} walks the same tree through
 * {@link #accept(SpecificationVisitor)} to build a native query.
 *
 * @param <T> aggregate type
 */
public abstract class Specification<T> {

    private final QueryShape shape;

    protected Specification(QueryShape shape) {
        this.shape = Objects.requireNonNull(shape, "shape");
    }

    public abstract boolean isSatisfiedBy(T candidate);

    public abstract <R> R accept(SpecificationVisitor<T, R> visitor);

    protected abstract Specification<T> withShape(QueryShape shape);

    public Specification<T> and(Specification<T> other) {
        return new AndSpecification<>(this, Objects.requireNonNull(other, "other"));
    }

    public Specification<T> or(Specification<T> other) {
        return new OrSpecification<>(this, Objects.requireNonNull(other, "other"));
    }

    public Specification<T> not() {
        return new NotSpecification<>(this);
    }

    public Specification<T> orderBy(String attribute, SortDirection direction) {
        return withShape(shape.withOrder(new SortOrder(attribute, direction)));
    }

    public Specification<T> orderBy(String attribute) {
        return orderBy(attribute, SortDirection.ASC);
    }

    public Specification<T> include(String association) {
        return withShape(shape.withInclude(association));
    }

    public List<SortOrder> getOrdering() {
        return shape.ordering();
    }

    public List<String> getIncludes() {
        return shape.includes();
    }

    QueryShape getShape() {
        return shape;
    }

    /** Keeps only the candidates that satisfy this specification, in their original order. */
    public <C extends T> List<C> filter(Collection<C> candidates) {
        return candidates.stream().filter(this::isSatisfiedBy).toList();
    }

    // --- leaf constructors ---

    public static <T, V> Specification<T> equal(String attribute, Function<T, V> accessor, V value) {
        return new AttributeSpecification<>(attribute, accessor, Operator.EQUAL, value);
    }

    public static <T, V> Specification<T> in(String attribute, Function<T, V> accessor, Collection<? extends V> values) {
        return new AttributeSpecification<>(attribute, accessor, Operator.IN, List.copyOf(values));
    }

    public static <T, V extends Comparable<? super V>> Specification<T> lessThan(String attribute, Function<T, V> accessor, V value) {
        return new AttributeSpecification<>(attribute, accessor, Operator.LESS_THAN, value);
    }

    public static <T, V extends Comparable<? super V>> Specification<T> lessThanOrEqual(String attribute, Function<T, V> accessor, V value) {
        return new AttributeSpecification<>(attribute, accessor, Operator.LESS_THAN_OR_EQUAL, value);
    }

    public static <T, V extends Comparable<? super V>> Specification<T> greaterThan(String attribute, Function<T, V> accessor, V value) {
        return new AttributeSpecification<>(attribute, accessor, Operator.GREATER_THAN, value);
    }

    public static <T, V extends Comparable<? super V>> Specification<T> greaterThanOrEqual(String attribute, Function<T, V> accessor, V value) {
        return new AttributeSpecification<>(attribute, accessor, Operator.GREATER_THAN_OR_EQUAL, value);
    }

    public static <T, V> Specification<T> isNull(String attribute, Function<T, V> accessor) {
        return new AttributeSpecification<>(attribute, accessor, Operator.IS_NULL, null);
    }

    public static <T, V> Specification<T> isNotNull(String attribute, Function<T, V> accessor) {
        return new AttributeSpecification<>(attribute, accessor, Operator.IS_NOT_NULL, null);
    }

    public static <T> Specification<T> isTrue(String attribute, Function<T, Boolean> accessor) {
        return new AttributeSpecification<>(attribute, accessor, Operator.EQUAL, Boolean.TRUE);
    }

    /**
     * In-memory only. Store adapters refuse to translate a tree containing one of these.
     */
    public static <T> Specification<T> where(String description, Predicate<T> predicate) {
        return new PredicateSpecification<>(description, predicate, QueryShape.EMPTY);
    }
}
