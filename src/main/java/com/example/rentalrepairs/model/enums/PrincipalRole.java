package com.example.rentalrepairs.model.enums;

public enum PrincipalRole {
    TENANT,
    WORKER,
    SUPERINTENDENT,
    SYSTEM
}
