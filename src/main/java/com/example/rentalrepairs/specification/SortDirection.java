package com.example.rentalrepairs.specification;

public enum SortDirection {
    ASC,
    DESC
}
