package com.koni.homeenergy.domain.model;

import lombok.Getter;

import java.util.List;

/**
 * Outcome of an unordered bulk insert: the samples that were stored and
 * one reason per sample that was not.
 */
@Getter
public class BulkInsertResult {

    private final List<Sample> inserted;
    private final List<String> failures;
    private final boolean storageUnavailable;

    public BulkInsertResult(List<Sample> inserted, List<String> failures, boolean storageUnavailable) {
        this.inserted = List.copyOf(inserted);
        this.failures = List.copyOf(failures);
        this.storageUnavailable = storageUnavailable;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
