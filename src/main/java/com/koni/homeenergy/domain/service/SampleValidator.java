package com.koni.homeenergy.domain.service;

import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.domain.exception.ValidationException.Violation;
import com.koni.homeenergy.domain.model.Sample;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Checks one sample against the ingestion business rules.
 *
 * Rules are evaluated in a fixed order and the first failure wins:
 * required fields, value range, timestamp plausibility, device id format, field lengths.
 * Batch callers pass the zero-based position so messages read {@code Record N: ...}.
 */
public class SampleValidator {

    public static final BigDecimal MIN_VALUE = BigDecimal.valueOf(-1_000_000L);
    public static final BigDecimal MAX_VALUE = BigDecimal.valueOf(1_000_000L);
    public static final Duration TIMESTAMP_TOLERANCE = Duration.ofDays(365);
    public static final int MAX_DEVICE_ID_LENGTH = 64;
    public static final int MAX_CATEGORY_LENGTH = 64;

    private static final Pattern DEVICE_ID = Pattern.compile("^[A-Za-z0-9_-]+$");

    private final Clock clock;

    public SampleValidator(Clock clock) {
        this.clock = clock;
    }

    public void validate(Sample sample) {
        validate(sample, null);
    }

    /**
     * @param sample the sample to check
     * @param indexInBatch zero-based batch position, or {@code null} for a single sample
     * @throws ValidationException describing the first broken rule
     */
    public void validate(Sample sample, Integer indexInBatch) {
        String prefix = indexInBatch == null ? "" : "Record " + (indexInBatch + 1) + ": ";

        if (sample.getDeviceId() == null) {
            throw new ValidationException(Violation.MISSING_FIELD, prefix + "deviceId is required");
        }
        if (sample.getCategory() == null || sample.getCategory().isBlank()) {
            throw new ValidationException(Violation.MISSING_FIELD, prefix + "category is required");
        }
        if (sample.getValue() == null) {
            throw new ValidationException(Violation.MISSING_FIELD, prefix + "value is required");
        }
        if (sample.getTimestamp() == null) {
            throw new ValidationException(Violation.MISSING_FIELD, prefix + "timestamp is required");
        }

        if (sample.getValue().compareTo(MIN_VALUE) < 0 || sample.getValue().compareTo(MAX_VALUE) > 0) {
            throw new ValidationException(Violation.VALUE_OUT_OF_RANGE,
                    prefix + "Value must be between -1,000,000 and 1,000,000");
        }

        Instant now = clock.instant();
        if (sample.getTimestamp().isBefore(now.minus(TIMESTAMP_TOLERANCE))
                || sample.getTimestamp().isAfter(now.plus(TIMESTAMP_TOLERANCE))) {
            throw new ValidationException(Violation.TIMESTAMP_IMPLAUSIBLE,
                    prefix + "Timestamp appears to be invalid");
        }

        if (!DEVICE_ID.matcher(sample.getDeviceId()).matches()) {
            throw new ValidationException(Violation.INVALID_DEVICE_ID,
                    prefix + "Device ID contains invalid characters");
        }

        if (sample.getDeviceId().length() > MAX_DEVICE_ID_LENGTH) {
            throw new ValidationException(Violation.FIELD_TOO_LONG,
                    prefix + "deviceId must be at most " + MAX_DEVICE_ID_LENGTH + " characters");
        }
        if (sample.getCategory().length() > MAX_CATEGORY_LENGTH) {
            throw new ValidationException(Violation.FIELD_TOO_LONG,
                    prefix + "category must be at most " + MAX_CATEGORY_LENGTH + " characters");
        }
    }
}
