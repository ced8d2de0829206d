package com.koni.homeenergy.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception thrown when some records of a batch could not be stored.
 * Records that were stored stay stored; the failure reasons are combined into one message.
 */
@Getter
public class BatchInsertFailedException extends RuntimeException {

    private final int insertedCount;
    private final int failedCount;

    public BatchInsertFailedException(int insertedCount, List<String> failures) {
        super("Batch insert failed: " + String.join("; ", failures));
        this.insertedCount = insertedCount;
        this.failedCount = failures.size();
    }
}
