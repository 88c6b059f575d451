package com.example.rentalrepairs.specification;

public final class AndSpecification<T> extends Specification<T> {

    private final Specification<T> left;
    private final Specification<T> right;

    AndSpecification(Specification<T> left, Specification<T> right) {
        this(left, right, left.getShape().merge(right.getShape()));
    }

    private AndSpecification(Specification<T> left, Specification<T> right, QueryShape shape) {
        super(shape);
        this.left = left;
        this.right = right;
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return left.isSatisfiedBy(candidate) && right.isSatisfiedBy(candidate);
    }

    @Override
    public <R> R accept(SpecificationVisitor<T, R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    protected Specification<T> withShape(QueryShape shape) {
        return new AndSpecification<>(left, right, shape);
    }

    public Specification<T> getLeft() {
        return left;
    }

    public Specification<T> getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "(" + left + " AND " + right + ")";
    }
}
