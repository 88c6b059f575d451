package com.example.rentalrepairs.service;

import java.util.List;

public record RegisterPropertyCommand(
        String code,
        String name,
        String street,
        String city,
        String postalCode,
        String superintendentEmail,
        List<String> units) {
}
