package com.example.rentalrepairs.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RentalRepairsProperties.class)
public class DomainConfig {

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
