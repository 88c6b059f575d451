package com.example.rentalrepairs.service;

/**
 * @param specialization enum name, display name or trade alias
 */
public record RegisterWorkerCommand(String email, String fullName, String specialization) {
}
