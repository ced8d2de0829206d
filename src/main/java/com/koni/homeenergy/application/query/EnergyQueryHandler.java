package com.koni.homeenergy.application.query;

import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.domain.exception.ValidationException.Violation;
import com.koni.homeenergy.domain.model.EnergyBucket;
import com.koni.homeenergy.domain.model.EnergyReport;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.domain.repository.DeviceRegistry;
import com.koni.homeenergy.domain.repository.SampleRepository;
import com.koni.homeenergy.domain.service.EnergyIntegrator;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Query handler for energy statistics derived from power samples.
 *
 * Only samples of the configured power category are integrated. Day buckets use
 * the configured time zone for calendar-day boundaries.
 */
@Service
@Slf4j
public class EnergyQueryHandler {

    private final SampleRepository sampleRepository;
    private final DeviceRegistry deviceRegistry;
    private final EnergyIntegrator energyIntegrator;
    private final ZoneId zone;
    private final String powerCategory;

    public EnergyQueryHandler(
            SampleRepository sampleRepository,
            DeviceRegistry deviceRegistry,
            EnergyIntegrator energyIntegrator,
            @Value("${telemetry.energy.zone:UTC}") String zone,
            @Value("${telemetry.energy.power-category:power}") String powerCategory) {
        this.sampleRepository = sampleRepository;
        this.deviceRegistry = deviceRegistry;
        this.energyIntegrator = energyIntegrator;
        this.zone = ZoneId.of(zone);
        this.powerCategory = powerCategory;
    }

    /**
     * Integrates the window and returns the total with its per-device breakdown.
     *
     * @throws ValidationException if a bound is missing or the window is empty
     */
    @Observed(name = "query.handler", contextualName = "energy-total")
    public EnergyReport handle(GetEnergyQuery query) {
        Instant start = query.getStartTime();
        Instant end = query.getEndTime();
        if (start == null || end == null) {
            throw new ValidationException(Violation.MISSING_FIELD, "startTime and endTime are required");
        }
        if (!end.isAfter(start)) {
            throw new ValidationException(Violation.INVALID_ENERGY_WINDOW, "endTime must be after startTime");
        }

        DeviceScope scope = DeviceScope.resolve(deviceRegistry, query.getDeviceId(), query.getDeviceType(), query.getRoom());
        List<Sample> samples = scope.matchesNothing()
                ? List.of()
                : sampleRepository.findForIntegration(scope.getDeviceIds(), powerCategory, start, end);

        EnergyReport report = energyIntegrator.integrate(samples, start, end);
        log.info("Energy for [{}, {}): {} Wh over {} devices", start, end, report.getEnergyWh(), report.getByDevice().size());
        return report;
    }

    /**
     * Returns one bucket per local calendar day in the inclusive range.
     *
     * @throws ValidationException if the range is missing, inverted or too long
     */
    @Observed(name = "query.handler", contextualName = "energy-daily")
    public List<EnergyBucket> handle(GetDailyEnergyQuery query) {
        LocalDate from = query.getFrom();
        LocalDate to = query.getTo();
        if (from == null || to == null) {
            throw new ValidationException(Violation.MISSING_FIELD, "from and to are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException(Violation.INVALID_ENERGY_WINDOW, "from must not be after to");
        }
        if (ChronoUnit.DAYS.between(from, to) + 1 > GetDailyEnergyQuery.MAX_DAYS) {
            throw new ValidationException(Violation.INVALID_ENERGY_WINDOW,
                    "Day range cannot exceed " + GetDailyEnergyQuery.MAX_DAYS + " days");
        }

        Instant start = from.atStartOfDay(zone).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(zone).toInstant();

        DeviceScope scope = DeviceScope.resolve(deviceRegistry, query.getDeviceId(), query.getDeviceType(), query.getRoom());
        List<Sample> samples = scope.matchesNothing()
                ? List.of()
                : sampleRepository.findForIntegration(scope.getDeviceIds(), powerCategory, start, end);

        List<EnergyBucket> buckets = energyIntegrator.dailyBuckets(samples, from, to, zone);
        if (log.isDebugEnabled()) {
            Map<LocalDate, BigDecimal> perDay = buckets.stream().collect(Collectors.toMap(
                    b -> LocalDate.ofInstant(b.getPeriodStart(), zone), EnergyBucket::getEnergyWh));
            log.debug("Daily energy {}..{} ({}): {}", from, to, zone, perDay);
        }
        return buckets;
    }
}
