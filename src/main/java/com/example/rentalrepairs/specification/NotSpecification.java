package com.example.rentalrepairs.specification;

public final class NotSpecification<T> extends Specification<T> {

    private final Specification<T> operand;

    NotSpecification(Specification<T> operand) {
        this(operand, operand.getShape());
    }

    private NotSpecification(Specification<T> operand, QueryShape shape) {
        super(shape);
        this.operand = operand;
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return !operand.isSatisfiedBy(candidate);
    }

    @Override
    public <R> R accept(SpecificationVisitor<T, R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    protected Specification<T> withShape(QueryShape shape) {
        return new NotSpecification<>(operand, shape);
    }

    public Specification<T> getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return "NOT " + operand;
    }
}
