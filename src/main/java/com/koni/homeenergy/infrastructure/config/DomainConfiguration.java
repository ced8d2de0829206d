package com.koni.homeenergy.infrastructure.config;

import com.koni.homeenergy.domain.service.EnergyIntegrator;
import com.koni.homeenergy.domain.service.SampleValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free domain services.
 * 
 * The {@link Clock} bean is the only source of "now" for validation, stats windows
 * and retention cutoffs; tests replace it with a fixed clock.
 */
@Configuration
public class DomainConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SampleValidator sampleValidator(Clock clock) {
        return new SampleValidator(clock);
    }

    @Bean
    public EnergyIntegrator energyIntegrator() {
        return new EnergyIntegrator();
    }
}
