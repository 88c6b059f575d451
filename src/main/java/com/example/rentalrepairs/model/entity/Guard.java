package com.example.rentalrepairs.model.entity;

import com.example.rentalrepairs.exception.DomainValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/** Argument checks shared by the aggregates. */
final class Guard {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private Guard() {
    }

    static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new DomainValidationException(field, field + " must not be blank");
        }
        return value.trim();
    }

    static String requireText(String field, String value, int maxLength) {
        String text = requireText(field, value);
        if (text.length() > maxLength) {
            throw new DomainValidationException(field, field + " must be at most " + maxLength + " characters");
        }
        return text;
    }

    static String requireEmail(String field, String value) {
        String email = requireText(field, value).toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(email).matches()) {
            throw new DomainValidationException(field, "Invalid email address: " + value);
        }
        return email;
    }

    static <T> T requireNonNull(String field, T value) {
        if (value == null) {
            throw new DomainValidationException(field, field + " is required");
        }
        return value;
    }
}
