package com.example.rentalrepairs.service;

import com.example.rentalrepairs.TestFixtures;
import com.example.rentalrepairs.exception.InvariantRule;
import com.example.rentalrepairs.exception.InvariantViolationException;
import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.repository.PropertyRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PropertyServiceTest {

    @Mock private PropertyRepository propertyRepository;

    private final Clock clock = Clock.fixed(TestFixtures.NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private final RegisterPropertyCommand elm = new RegisterPropertyCommand("elm", "Elm Court", "1 Elm St",
            "Springfield", "11111", TestFixtures.SUPERINTENDENT, List.of("1A", "1B"));

    @Test
    void registerProperty_normalizesCodeAndStores() {
        when(propertyRepository.add(any())).thenAnswer(invocation -> invocation.getArgument(0));

        Property property = new PropertyService(propertyRepository, clock).registerProperty(elm);

        assertThat(property.getCode()).isEqualTo("ELM");
        assertThat(property.getUnits()).containsExactly("1A", "1B");
    }

    @Test
    void registerProperty_uniqueKeyClashOnInsert_isReportedAsDuplicate() {
        when(propertyRepository.add(any())).thenThrow(new DataIntegrityViolationException("unique code"));

        assertThatThrownBy(() -> new PropertyService(propertyRepository, clock).registerProperty(elm))
                .isInstanceOf(InvariantViolationException.class)
                .extracting("rule").isEqualTo(InvariantRule.DUPLICATE_PROPERTY);
    }
}
