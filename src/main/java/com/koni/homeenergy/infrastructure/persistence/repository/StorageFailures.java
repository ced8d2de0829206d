package com.koni.homeenergy.infrastructure.persistence.repository;

import com.koni.homeenergy.domain.exception.StorageUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Translates store connectivity failures into {@link StorageUnavailableException}.
 * Other persistence errors pass through unchanged.
 */
final class StorageFailures {

    private StorageFailures() {
    }

    static boolean isUnavailable(Throwable e) {
        return e instanceof TransientDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof CannotCreateTransactionException;
    }

    static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            if (isUnavailable(e)) {
                throw new StorageUnavailableException("Sample store unavailable during " + operation, e);
            }
            throw e;
        }
    }
}
