package com.example.rentalrepairs.specification;

import java.util.Objects;
import java.util.function.Function;

/**
 * Compares one mapped attribute against an operand. The attribute path (dot separated for
 * embedded values) is what store adapters translate; the accessor is what in-memory evaluation
 * reads. Both must describe the same value.
 */
public final class AttributeSpecification<T, V> extends Specification<T> {

    private final String attribute;
    private final Function<T, V> accessor;
    private final Operator operator;
    private final Object operand;

    AttributeSpecification(String attribute, Function<T, V> accessor, Operator operator, Object operand) {
        this(attribute, accessor, operator, operand, QueryShape.EMPTY);
    }

    private AttributeSpecification(String attribute, Function<T, V> accessor, Operator operator, Object operand,
                                   QueryShape shape) {
        super(shape);
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("attribute must not be blank");
        }
        this.attribute = attribute;
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = operand;
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return operator.test(accessor.apply(candidate), operand);
    }

    @Override
    public <R> R accept(SpecificationVisitor<T, R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    protected Specification<T> withShape(QueryShape shape) {
        return new AttributeSpecification<>(attribute, accessor, operator, operand, shape);
    }

    public String getAttribute() {
        return attribute;
    }

    public Operator getOperator() {
        return operator;
    }

    public Object getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return attribute + " " + operator + (operand != null ? " " + operand : "");
    }
}
