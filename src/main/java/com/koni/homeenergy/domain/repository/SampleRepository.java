package com.koni.homeenergy.domain.repository;

import com.koni.homeenergy.domain.model.BulkInsertResult;
import com.koni.homeenergy.domain.model.CategoryStats;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.domain.model.SampleCriteria;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Repository interface for the append-only sample store.
 * This interface is part of the domain layer; infrastructure adapters implement it.
 *
 * Implementations rely on the store's own concurrency control. Callers never hold
 * locks around these methods.
 */
public interface SampleRepository {

    /**
     * Persists one sample.
     *
     * @param sample the sample to store
     * @return the stored sample with its server-assigned id
     * @throws com.koni.homeenergy.domain.exception.StorageUnavailableException if the store is unreachable
     */
    Sample save(Sample sample);

    /**
     * Persists samples independently of each other. A failure to store one sample
     * never prevents the others from being stored, and stored samples are not rolled back.
     *
     * @param samples the samples to store
     * @return which samples were stored and why the others were not
     */
    BulkInsertResult saveAllUnordered(List<Sample> samples);

    /**
     * Finds samples whose timestamp or receivedAt falls inside the criteria window,
     * newest timestamp first.
     */
    List<Sample> find(SampleCriteria criteria);

    /**
     * Finds samples of one category with {@code from <= timestamp < to}, oldest first.
     *
     * @param deviceIds devices to include, or {@code null} for all devices
     */
    List<Sample> findForIntegration(Set<String> deviceIds, String category, Instant from, Instant to);

    /**
     * Aggregates a device's samples with {@code from <= timestamp <= to} per category.
     */
    List<CategoryStats> statsByCategory(String deviceId, Instant from, Instant to);

    /**
     * Deletes every sample whose timestamp is strictly before the cutoff.
     *
     * @return number of deleted samples
     */
    long deleteOlderThan(Instant cutoff);
}
