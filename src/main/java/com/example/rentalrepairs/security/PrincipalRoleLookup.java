package com.example.rentalrepairs.security;

/**
 * Resolves a user id to its roles and relationships. Identity management itself is external;
 * this is the only question the domain asks of it.
 */
public interface PrincipalRoleLookup {

    /**
     * Never returns {@code null}; unknown users come back without roles.
     */
    Principal resolve(String userId);
}
