package com.koni.homeenergy.infrastructure.persistence.repository;

import com.koni.homeenergy.domain.model.BulkInsertResult;
import com.koni.homeenergy.domain.model.CategoryStats;
import com.koni.homeenergy.domain.model.Device;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.domain.model.SampleCriteria;
import com.koni.homeenergy.infrastructure.persistence.entity.DeviceEntity;
import com.koni.homeenergy.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Persistence adapters against a real PostgreSQL.
 * Skipped when Docker is not available.
 */
@IntegrationTest
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JpaSampleRepositoryAdapterPostgresTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16"))
            .withDatabaseName("home_energy_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private JpaSampleRepositoryAdapter sampleRepository;

    @Autowired
    private JpaDeviceRegistryAdapter deviceRegistry;

    @Autowired
    private SampleJpaRepository sampleJpaRepository;

    @Autowired
    private DeviceJpaRepository deviceJpaRepository;

    private final Instant base = Instant.now().truncatedTo(ChronoUnit.HOURS).minus(1, ChronoUnit.DAYS);

    @BeforeEach
    void setUp() {
        sampleJpaRepository.deleteAll();
        deviceJpaRepository.deleteAll();
        deviceJpaRepository.saveAll(List.of(
                new DeviceEntity("dev-001", "Fridge", "appliance", "Kitchen", null),
                new DeviceEntity("dev-002", "Heater", "heater", "Bedroom", null)));
    }

    @Test
    void shouldStoreUnorderedBatchAndFindNewestFirst() {
        BulkInsertResult result = sampleRepository.saveAllUnordered(List.of(
                sample("dev-001", "power", "10", base),
                sample("dev-001", "power", "20", base.plus(5, ChronoUnit.MINUTES)),
                sample("dev-002", "power", "30", base.plus(10, ChronoUnit.MINUTES))));

        assertThat(result.hasFailures()).isFalse();
        assertThat(result.getInserted()).allSatisfy(sample -> assertThat(sample.isPersisted()).isTrue());

        List<Sample> found = sampleRepository.find(new SampleCriteria(Set.of("dev-001"), base, base.plus(1, ChronoUnit.HOURS)));
        assertThat(found).extracting(Sample::getValue)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("20"), new BigDecimal("10"));
    }

    @Test
    void shouldFindIntegrationSamplesAscendingAndCaseInsensitive() {
        sampleRepository.saveAllUnordered(List.of(
                sample("dev-001", "Power", "200", base.plus(30, ChronoUnit.MINUTES)),
                sample("dev-001", "power", "100", base),
                sample("dev-001", "temperature", "4", base),
                sample("dev-001", "power", "999", base.plus(1, ChronoUnit.HOURS))));

        List<Sample> samples = sampleRepository.findForIntegration(null, "power", base, base.plus(1, ChronoUnit.HOURS));

        assertThat(samples).extracting(Sample::getTimestamp)
                .containsExactly(base, base.plus(30, ChronoUnit.MINUTES));
    }

    @Test
    void shouldAggregateStatsPerCategory() {
        sampleRepository.saveAllUnordered(List.of(
                sample("dev-001", "power", "100", base),
                sample("dev-001", "power", "300", base.plus(1, ChronoUnit.HOURS)),
                sample("dev-001", "humidity", "40", base)));

        List<CategoryStats> stats = sampleRepository.statsByCategory("dev-001", base, base.plus(2, ChronoUnit.HOURS));

        assertThat(stats).extracting(CategoryStats::getCategory).containsExactly("humidity", "power");
        CategoryStats power = stats.get(1);
        assertThat(power.getCount()).isEqualTo(2);
        assertThat(power.getAvgValue()).isEqualTo(200.0);
        assertThat(power.getLastReading()).isEqualTo(base.plus(1, ChronoUnit.HOURS));
    }

    @Test
    void shouldResolveDevicesByRoomIgnoringCase() {
        assertThat(deviceRegistry.findByTypeOrRoom(null, "kitchen"))
                .extracting(Device::getDeviceId).containsExactly("dev-001");
        assertThat(deviceRegistry.findMany(List.of("dev-002", "ghost-1")))
                .extracting(Device::getDeviceId).containsExactly("dev-002");
        assertThat(deviceRegistry.exists("ghost-1")).isFalse();
    }

    private static Sample sample(String deviceId, String category, String value, Instant timestamp) {
        return new Sample(null, deviceId, category, new BigDecimal(value), true, timestamp, Instant.now());
    }
}
