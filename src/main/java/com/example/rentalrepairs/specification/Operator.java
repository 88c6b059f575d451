package com.example.rentalrepairs.specification;

import java.util.Collection;
import java.util.Objects;

public enum Operator {
    EQUAL,
    IN,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    IS_NULL,
    IS_NOT_NULL;

    boolean test(Object actual, Object operand) {
        switch (this) {
            case EQUAL:
                return Objects.equals(actual, operand);
            case IN:
                return actual != null && ((Collection<?>) operand).contains(actual);
            case IS_NULL:
                return actual == null;
            case IS_NOT_NULL:
                return actual != null;
            default:
                break;
        }
        // null never orders against anything, same as SQL
        if (actual == null) {
            return false;
        }
        int comparison = compare(actual, operand);
        switch (this) {
            case LESS_THAN:
                return comparison < 0;
            case LESS_THAN_OR_EQUAL:
                return comparison <= 0;
            case GREATER_THAN:
                return comparison > 0;
            case GREATER_THAN_OR_EQUAL:
                return comparison >= 0;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    @SuppressWarnings("unchecked")
    private static int compare(Object actual, Object operand) {
        return ((Comparable<Object>) actual).compareTo(operand);
    }
}
