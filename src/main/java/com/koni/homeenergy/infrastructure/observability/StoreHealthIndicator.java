package com.koni.homeenergy.infrastructure.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Health indicator for the sample store.
 * 
 * Runs {@code SELECT 1} against the store's DataSource. Reported as {@code store}
 * under /actuator/health.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreHealthIndicator implements HealthIndicator {

    private final DataSource dataSource;

    @Override
    public Health health() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT 1")) {

            if (!resultSet.next() || resultSet.getInt(1) != 1) {
                log.error("Store health check failed: SELECT 1 returned an unexpected result");
                return Health.down()
                        .withDetail("error", "QueryValidationFailed")
                        .build();
            }

            DatabaseMetaData metaData = connection.getMetaData();
            log.debug("Store health check passed: product={}", metaData.getDatabaseProductName());
            return Health.up()
                    .withDetail("database", metaData.getDatabaseProductName())
                    .withDetail("version", metaData.getDatabaseProductVersion())
                    .build();

        } catch (Exception e) {
            log.error("Store health check failed", e);
            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
