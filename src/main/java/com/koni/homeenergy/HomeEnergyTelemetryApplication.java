package com.koni.homeenergy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HomeEnergyTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(HomeEnergyTelemetryApplication.class, args);
    }
}
