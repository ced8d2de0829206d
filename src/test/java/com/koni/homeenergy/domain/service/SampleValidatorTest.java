package com.koni.homeenergy.domain.service;

import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.domain.exception.ValidationException.Violation;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class SampleValidatorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final SampleValidator validator = new SampleValidator(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldAcceptValidSample() {
        assertThatCode(() -> validator.validate(sample("dev-001", "1500.5", NOW.minusSeconds(60))))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"-1000000", "1000000", "0"})
    void shouldAcceptValuesAtTheBounds(String value) {
        assertThatCode(() -> validator.validate(sample("dev-001", value, NOW)))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"-1000000.01", "1000000.000001", "5000000"})
    void shouldRejectValueOutOfRange(String value) {
        assertThatThrownBy(() -> validator.validate(sample("dev-001", value, NOW)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Value must be between -1,000,000 and 1,000,000")
                .extracting("violation").isEqualTo(Violation.VALUE_OUT_OF_RANGE);
    }

    @Test
    void shouldRejectTimestampMoreThanOneYearAway() {
        Instant past = NOW.minus(Duration.ofDays(366));
        Instant future = NOW.plus(Duration.ofDays(366));

        assertThatThrownBy(() -> validator.validate(sample("dev-001", "10", past)))
                .extracting("violation").isEqualTo(Violation.TIMESTAMP_IMPLAUSIBLE);
        assertThatThrownBy(() -> validator.validate(sample("dev-001", "10", future)))
                .hasMessage("Timestamp appears to be invalid");
    }

    @Test
    void shouldAcceptTimestampExactlyOneYearAway() {
        assertThatCode(() -> validator.validate(sample("dev-001", "10", NOW.minus(Duration.ofDays(365)))))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"dev 001", "dev/001", "dév", "dev.001", ""})
    void shouldRejectDeviceIdWithInvalidCharacters(String deviceId) {
        assertThatThrownBy(() -> validator.validate(sample(deviceId, "10", NOW)))
                .hasMessage("Device ID contains invalid characters")
                .extracting("violation").isEqualTo(Violation.INVALID_DEVICE_ID);
    }

    @Test
    void shouldReportFirstBrokenRuleOnly() {
        // out of range value and bad device id: value is checked first
        assertThatThrownBy(() -> validator.validate(sample("bad id", "2000000", NOW)))
                .extracting("violation").isEqualTo(Violation.VALUE_OUT_OF_RANGE);
    }

    @Test
    void shouldRejectMissingFields() {
        assertThatThrownBy(() -> validator.validate(new Sample(null, "power", BigDecimal.ONE, true, NOW)))
                .hasMessage("deviceId is required")
                .extracting("violation").isEqualTo(Violation.MISSING_FIELD);
        assertThatThrownBy(() -> validator.validate(new Sample("dev-001", " ", BigDecimal.ONE, true, NOW)))
                .hasMessage("category is required");
        assertThatThrownBy(() -> validator.validate(new Sample("dev-001", "power", null, true, NOW)))
                .hasMessage("value is required");
        assertThatThrownBy(() -> validator.validate(new Sample("dev-001", "power", BigDecimal.ONE, true, null)))
                .hasMessage("timestamp is required");
    }

    @Test
    void shouldPrefixBatchErrorsWithOneBasedIndex() {
        assertThatThrownBy(() -> validator.validate(sample("dev-001", "-2000000", NOW), 2))
                .hasMessage("Record 3: Value must be between -1,000,000 and 1,000,000");
    }

    @Test
    void shouldRejectFieldsLongerThanTheStoreKeeps() {
        String longCategory = "c".repeat(SampleValidator.MAX_CATEGORY_LENGTH + 1);

        assertThatThrownBy(() -> validator.validate(new Sample("dev-001", longCategory, BigDecimal.ONE, true, NOW), 1))
                .hasMessage("Record 2: category must be at most 64 characters")
                .extracting("violation").isEqualTo(Violation.FIELD_TOO_LONG);
        assertThatThrownBy(() -> validator.validate(sample("d".repeat(65), "1", NOW)))
                .hasMessage("deviceId must be at most 64 characters");
        assertThatCode(() -> validator.validate(
                new Sample("d".repeat(64), "c".repeat(64), BigDecimal.ONE, true, NOW)))
                .doesNotThrowAnyException();
    }

    private static Sample sample(String deviceId, String value, Instant timestamp) {
        return new Sample(deviceId, "power", new BigDecimal(value), true, timestamp);
    }
}
