package com.example.rentalrepairs.specification;

import com.example.rentalrepairs.exception.UnsupportedSpecificationException;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EmbeddableType;
import jakarta.persistence.metamodel.ManagedType;
import jakarta.persistence.metamodel.Metamodel;
import org.springframework.data.domain.Sort;

import java.util.Collection;
import java.util.List;

/**
 * Translates a {@link Specification} tree into a Spring Data JPA specification and {@link Sort}.
 *
 * <p>The whole tree is validated against the JPA metamodel when {@link #translate} is called.
 * In-memory predicates, unknown attribute paths and includes that cannot be fetch-joined are
 * rejected there with {@link UnsupportedSpecificationException}, so a query that reaches the
 * database is always one this adapter fully understands.
 *
 * <p>Every comparison leaf is false, never unknown, for a null column, matching
 * {@link Specification#isSatisfiedBy} under {@code not()}.
 */
public class JpaSpecificationTranslator<T> {

    private final Class<T> entityType;
    private final Metamodel metamodel;

    public JpaSpecificationTranslator(Class<T> entityType, Metamodel metamodel) {
        this.entityType = entityType;
        this.metamodel = metamodel;
    }

    public TranslatedQuery<T> translate(Specification<T> specification) {
        org.springframework.data.jpa.domain.Specification<T> predicate = specification.accept(new PredicateTranslator());
        List<String> includes = specification.getIncludes();
        includes.forEach(this::requireFetchable);

        org.springframework.data.jpa.domain.Specification<T> withFetches = (root, query, cb) -> {
            // count queries cannot carry fetch joins
            if (!includes.isEmpty() && query != null && !isCountQuery(query.getResultType())) {
                includes.forEach(association -> root.fetch(association, JoinType.LEFT));
                query.distinct(true);
            }
            return predicate.toPredicate(root, query, cb);
        };
        return new TranslatedQuery<>(withFetches, toSort(specification.getOrdering()));
    }

    private Sort toSort(List<SortOrder> ordering) {
        if (ordering.isEmpty()) {
            return Sort.unsorted();
        }
        ordering.forEach(order -> requireAttribute(order.attribute()));
        List<Sort.Order> orders = ordering.stream()
                .map(order -> order.direction() == SortDirection.ASC
                        ? Sort.Order.asc(order.attribute())
                        : Sort.Order.desc(order.attribute()))
                .toList();
        return Sort.by(orders);
    }

    private static boolean isCountQuery(Class<?> resultType) {
        return resultType == Long.class || resultType == long.class;
    }

    private Attribute<?, ?> requireAttribute(String path) {
        ManagedType<?> current = metamodel.managedType(entityType);
        String[] segments = path.split("\\.");
        Attribute<?, ?> attribute = null;
        for (int i = 0; i < segments.length; i++) {
            try {
                attribute = current.getAttribute(segments[i]);
            } catch (IllegalArgumentException e) {
                throw new UnsupportedSpecificationException(
                        "Unknown attribute '" + path + "' on " + entityType.getSimpleName());
            }
            if (i < segments.length - 1) {
                if (attribute.getPersistentAttributeType() != Attribute.PersistentAttributeType.EMBEDDED) {
                    throw new UnsupportedSpecificationException(
                            "Attribute path '" + path + "' can only traverse embedded values");
                }
                current = (EmbeddableType<?>) metamodel.embeddable(attribute.getJavaType());
            }
        }
        return attribute;
    }

    private void requireFetchable(String include) {
        if (include.contains(".")) {
            throw new UnsupportedSpecificationException(
                    "Include '" + include + "' must name a direct association of " + entityType.getSimpleName());
        }
        Attribute<?, ?> attribute = requireAttribute(include);
        if (!attribute.isAssociation() && !attribute.isCollection()) {
            throw new UnsupportedSpecificationException(
                    "Include '" + include + "' on " + entityType.getSimpleName()
                            + " is not an association or collection and cannot be fetched");
        }
    }

    private static <Y> Path<Y> resolve(Root<?> root, String attribute) {
        Path<?> path = root;
        for (String segment : attribute.split("\\.")) {
            path = path.get(segment);
        }
        @SuppressWarnings("unchecked")
        Path<Y> typed = (Path<Y>) path;
        return typed;
    }

    private final class PredicateTranslator implements SpecificationVisitor<T, org.springframework.data.jpa.domain.Specification<T>> {

        @Override
        public org.springframework.data.jpa.domain.Specification<T> visitAttribute(AttributeSpecification<T, ?> specification) {
            Operator operator = specification.getOperator();
            requireAttribute(specification.getAttribute());
            String attribute = specification.getAttribute();
            Object operand = specification.getOperand();
            return (root, query, cb) -> toPredicate(cb, resolve(root, attribute), operator, operand);
        }

        @Override
        public org.springframework.data.jpa.domain.Specification<T> visitPredicate(PredicateSpecification<T> specification) {
            throw new UnsupportedSpecificationException(
                    "In-memory predicate '" + specification.getDescription() + "' cannot be translated to a JPA query");
        }

        @Override
        public org.springframework.data.jpa.domain.Specification<T> visitAnd(AndSpecification<T> specification) {
            var left = specification.getLeft().accept(this);
            var right = specification.getRight().accept(this);
            return (root, query, cb) -> cb.and(left.toPredicate(root, query, cb), right.toPredicate(root, query, cb));
        }

        @Override
        public org.springframework.data.jpa.domain.Specification<T> visitOr(OrSpecification<T> specification) {
            var left = specification.getLeft().accept(this);
            var right = specification.getRight().accept(this);
            return (root, query, cb) -> cb.or(left.toPredicate(root, query, cb), right.toPredicate(root, query, cb));
        }

        @Override
        public org.springframework.data.jpa.domain.Specification<T> visitNot(NotSpecification<T> specification) {
            var operand = specification.getOperand().accept(this);
            return (root, query, cb) -> cb.not(operand.toPredicate(root, query, cb));
        }
    }

    private static Predicate toPredicate(CriteriaBuilder cb, Path<?> path, Operator operator, Object operand) {
        return switch (operator) {
            case EQUAL -> operand == null ? cb.isNull(path) : presentAnd(cb, path, cb.equal(path, operand));
            case IN -> {
                Collection<?> values = (Collection<?>) operand;
                yield values.isEmpty() ? cb.disjunction() : presentAnd(cb, path, path.in(values));
            }
            case LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL ->
                    presentAnd(cb, path, compare(cb, path, operator, operand));
            case IS_NULL -> cb.isNull(path);
            case IS_NOT_NULL -> cb.isNotNull(path);
        };
    }

    // FALSE AND UNKNOWN is FALSE, so the leaf stays two-valued when the column is null
    private static Predicate presentAnd(CriteriaBuilder cb, Path<?> path, Predicate predicate) {
        return cb.and(cb.isNotNull(path), predicate);
    }

    @SuppressWarnings("unchecked")
    private static Predicate compare(CriteriaBuilder cb, Path<?> path, Operator operator, Object operand) {
        Expression<Comparable<Object>> expression = (Expression<Comparable<Object>>) path;
        Comparable<Object> value = (Comparable<Object>) operand;
        return switch (operator) {
            case LESS_THAN -> cb.lessThan(expression, value);
            case LESS_THAN_OR_EQUAL -> cb.lessThanOrEqualTo(expression, value);
            case GREATER_THAN -> cb.greaterThan(expression, value);
            case GREATER_THAN_OR_EQUAL -> cb.greaterThanOrEqualTo(expression, value);
            default -> throw new IllegalArgumentException(operator + " is not an ordering operator");
        };
    }
}
