package com.example.rentalrepairs.specification;

import com.example.rentalrepairs.model.entity.Property;

import java.util.Locale;

public final class PropertySpecifications {

    private PropertySpecifications() {
    }

    public static Specification<Property> active() {
        return Specification.isTrue("active", Property::isActive);
    }

    public static Specification<Property> byCode(String code) {
        return Specification.equal("code", Property::getCode, code.trim().toUpperCase(Locale.ROOT));
    }

    public static Specification<Property> inCity(String city) {
        Specification<Property> sameCity =
                Specification.equal("address.city", property -> property.getAddress().getCity(), city.trim());
        return sameCity.orderBy("code");
    }

    public static Specification<Property> managedBy(String superintendentEmail) {
        return Specification.equal("superintendentEmail", Property::getSuperintendentEmail,
                superintendentEmail.trim().toLowerCase(Locale.ROOT));
    }
}
