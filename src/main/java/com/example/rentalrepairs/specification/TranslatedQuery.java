package com.example.rentalrepairs.specification;

import org.springframework.data.domain.Sort;

/**
 * Store-native form of a specification for Spring Data JPA.
 */
public record TranslatedQuery<T>(org.springframework.data.jpa.domain.Specification<T> filter, Sort sort) {
}
