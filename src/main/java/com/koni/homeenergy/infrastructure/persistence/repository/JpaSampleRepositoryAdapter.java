package com.koni.homeenergy.infrastructure.persistence.repository;

import com.koni.homeenergy.domain.model.BulkInsertResult;
import com.koni.homeenergy.domain.model.CategoryStats;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.domain.model.SampleCriteria;
import com.koni.homeenergy.domain.repository.SampleRepository;
import com.koni.homeenergy.infrastructure.persistence.entity.SampleEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JPA adapter for SampleRepository.
 *
 * This adapter implements the domain repository interface and delegates to the JPA
 * repository, mapping between Sample and SampleEntity. Each insert of an unordered
 * bulk write runs in its own repository transaction, so a failed row never rolls back
 * rows written before it.
 *
 * Values and timestamps are brought to the column scale and resolution before they
 * are written, so the sample handed back is the one the store holds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSampleRepositoryAdapter implements SampleRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "timestamp");

    private final SampleJpaRepository jpaRepository;

    @Override
    @Observed(name = "sample.store", contextualName = "sample-save")
    public Sample save(Sample sample) {
        if (sample == null) {
            throw new IllegalArgumentException("Sample cannot be null");
        }
        return StorageFailures.translate("save", () -> toDomain(jpaRepository.save(toEntity(sample))));
    }

    @Override
    @Observed(name = "sample.store", contextualName = "sample-save-unordered")
    public BulkInsertResult saveAllUnordered(List<Sample> samples) {
        List<Sample> inserted = new ArrayList<>(samples.size());
        List<String> failures = new ArrayList<>();
        boolean allUnavailable = true;

        for (Sample sample : samples) {
            try {
                inserted.add(toDomain(jpaRepository.save(toEntity(sample))));
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed to store sample: deviceId={}, timestamp={}", sample.getDeviceId(), sample.getTimestamp(), e);
                failures.add("device '" + sample.getDeviceId() + "' at " + sample.getTimestamp() + ": "
                        + e.getMostSpecificCause().getMessage());
                allUnavailable &= StorageFailures.isUnavailable(e);
            }
        }
        return new BulkInsertResult(inserted, failures, !failures.isEmpty() && allUnavailable);
    }

    @Override
    @Observed(name = "sample.store", contextualName = "sample-find")
    public List<Sample> find(SampleCriteria criteria) {
        return StorageFailures.translate("find", () ->
                jpaRepository.findAll(SampleSpecifications.matching(criteria), NEWEST_FIRST).stream()
                        .map(this::toDomain)
                        .collect(Collectors.toList()));
    }

    @Override
    public List<Sample> findForIntegration(Set<String> deviceIds, String category, Instant from, Instant to) {
        return StorageFailures.translate("findForIntegration", () -> {
            List<SampleEntity> entities = deviceIds == null
                    ? jpaRepository.findPowerSamples(category, from, to)
                    : jpaRepository.findPowerSamples(deviceIds, category, from, to);
            return entities.stream().map(this::toDomain).collect(Collectors.toList());
        });
    }

    @Override
    public List<CategoryStats> statsByCategory(String deviceId, Instant from, Instant to) {
        return StorageFailures.translate("statsByCategory", () ->
                jpaRepository.statsByCategory(deviceId, from, to).stream()
                        .map(row -> new CategoryStats(
                                row.getCategory(),
                                row.getCount(),
                                row.getAvgValue() == null ? 0.0 : row.getAvgValue(),
                                row.getMinValue(),
                                row.getMaxValue(),
                                row.getLastReading()))
                        .collect(Collectors.toList()));
    }

    @Override
    @Observed(name = "sample.store", contextualName = "sample-delete-older-than")
    public long deleteOlderThan(Instant cutoff) {
        return StorageFailures.translate("deleteOlderThan", () -> (long) jpaRepository.deleteByTimestampBefore(cutoff));
    }

    private SampleEntity toEntity(Sample sample) {
        return new SampleEntity(
                sample.getDeviceId(),
                sample.getCategory(),
                storedValue(sample.getValue()),
                sample.isStatus(),
                storedInstant(sample.getTimestamp()),
                storedInstant(sample.getReceivedAt())
        );
    }

    private static BigDecimal storedValue(BigDecimal value) {
        if (value == null || value.scale() <= SampleEntity.VALUE_SCALE) {
            return value;
        }
        return value.setScale(SampleEntity.VALUE_SCALE, RoundingMode.HALF_UP);
    }

    private static Instant storedInstant(Instant instant) {
        return instant == null ? null : instant.truncatedTo(SampleEntity.TIMESTAMP_RESOLUTION);
    }

    private Sample toDomain(SampleEntity entity) {
        return new Sample(
                entity.getId(),
                entity.getDeviceId(),
                entity.getCategory(),
                entity.getValue(),
                entity.isStatus(),
                entity.getTimestamp(),
                entity.getReceivedAt()
        );
    }
}
