package com.koni.homeenergy.application.query;

import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.domain.exception.ValidationException.Violation;
import com.koni.homeenergy.domain.model.EnergyBucket;
import com.koni.homeenergy.domain.model.EnergyReport;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.domain.repository.DeviceRegistry;
import com.koni.homeenergy.domain.repository.SampleRepository;
import com.koni.homeenergy.domain.service.EnergyIntegrator;
import com.koni.homeenergy.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@UnitTest
@ExtendWith(MockitoExtension.class)
class EnergyQueryHandlerTest {

    private static final Instant START = Instant.parse("2025-03-10T00:00:00Z");
    private static final Instant END = Instant.parse("2025-03-10T01:00:00Z");

    @Mock
    private SampleRepository sampleRepository;

    @Mock
    private DeviceRegistry deviceRegistry;

    private EnergyQueryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new EnergyQueryHandler(sampleRepository, deviceRegistry, new EnergyIntegrator(), "Europe/Berlin", "power");
    }

    @Test
    void shouldIntegratePowerSamplesOfTheDevice() {
        when(sampleRepository.findForIntegration(Set.of("dev-001"), "power", START, END)).thenReturn(List.of(
                sample("2025-03-10T00:00:00Z", "100"),
                sample("2025-03-10T00:30:00Z", "200")));

        EnergyReport report = handler.handle(new GetEnergyQuery("dev-001", null, null, START, END));

        assertThat(report.getEnergyWh()).isEqualByComparingTo("150");
        assertThat(report.getByDevice().get("dev-001").getEnergyKWh()).isEqualByComparingTo("0.15");
    }

    @Test
    void shouldRejectMissingOrEmptyWindow() {
        assertThatThrownBy(() -> handler.handle(new GetEnergyQuery(null, null, null, START, null)))
                .extracting("violation").isEqualTo(Violation.MISSING_FIELD);
        assertThatThrownBy(() -> handler.handle(new GetEnergyQuery(null, null, null, END, START)))
                .isInstanceOf(ValidationException.class)
                .extracting("violation").isEqualTo(Violation.INVALID_ENERGY_WINDOW);
        verifyNoInteractions(sampleRepository);
    }

    @Test
    void shouldReturnZeroWhenRoomHasNoDevices() {
        when(deviceRegistry.findByTypeOrRoom(null, "attic")).thenReturn(List.of());

        EnergyReport report = handler.handle(new GetEnergyQuery(null, null, "attic", START, END));

        assertThat(report.getEnergyWh()).isEqualByComparingTo("0");
        verifyNoInteractions(sampleRepository);
    }

    @Test
    void shouldBucketByLocalDayInConfiguredZone() {
        // Berlin is UTC+1 in early March
        Instant from = Instant.parse("2025-03-09T23:00:00Z");
        Instant to = Instant.parse("2025-03-11T23:00:00Z");
        when(sampleRepository.findForIntegration(null, "power", from, to))
                .thenReturn(List.of(sample("2025-03-09T23:00:00Z", "10")));

        List<EnergyBucket> buckets = handler.handle(new GetDailyEnergyQuery(null, null, null,
                LocalDate.of(2025, 3, 10), LocalDate.of(2025, 3, 11)));

        assertThat(buckets).hasSize(2);
        assertThat(buckets.get(0).getPeriodStart()).isEqualTo(from);
        assertThat(buckets).allSatisfy(bucket -> assertThat(bucket.getEnergyWh()).isEqualByComparingTo("240"));
    }

    @Test
    void shouldRejectInvertedOrOversizedDayRange() {
        assertThatThrownBy(() -> handler.handle(new GetDailyEnergyQuery(null, null, null,
                LocalDate.of(2025, 3, 11), LocalDate.of(2025, 3, 10))))
                .extracting("violation").isEqualTo(Violation.INVALID_ENERGY_WINDOW);
        assertThatThrownBy(() -> handler.handle(new GetDailyEnergyQuery(null, null, null,
                LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1))))
                .hasMessage("Day range cannot exceed 366 days");
    }

    private static Sample sample(String timestamp, String watts) {
        return new Sample("dev-001", "power", new BigDecimal(watts), true, Instant.parse(timestamp));
    }
}
