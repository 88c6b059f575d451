package com.example.rentalrepairs.specification;

import java.util.Objects;

public record SortOrder(String attribute, SortDirection direction) {

    public SortOrder {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(direction, "direction");
    }
}
