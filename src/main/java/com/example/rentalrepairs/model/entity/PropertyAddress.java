package com.example.rentalrepairs.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class PropertyAddress {

    @Column(name = "street", nullable = false)
    private String street;

    @Column(name = "city", nullable = false)
    private String city;

    @Column(name = "postal_code", nullable = false)
    private String postalCode;

    protected PropertyAddress() {
    }

    public PropertyAddress(String street, String city, String postalCode) {
        this.street = Guard.requireText("address.street", street);
        this.city = Guard.requireText("address.city", city);
        this.postalCode = Guard.requireText("address.postalCode", postalCode);
    }

    public String getStreet() {
        return street;
    }

    public String getCity() {
        return city;
    }

    public String getPostalCode() {
        return postalCode;
    }

    @Override
    public String toString() {
        return street + ", " + city + " " + postalCode;
    }
}
