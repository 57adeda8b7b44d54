package com.cinematic.engine.persistence.jdbc;

import com.cinematic.core.exception.PersistenceUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Translates connectivity failures of the database into {@link PersistenceUnavailableException},
 * which the scheduler treats as a control-plane outage. Other data access errors pass through.
 */
final class PersistenceGuard {

    private PersistenceGuard() {
    }

    static <T> T call(String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException
                 | TransientDataAccessResourceException
                 | RecoverableDataAccessException
                 | CannotCreateTransactionException e) {
            throw new PersistenceUnavailableException("Database unavailable during " + what + ": " + e.getMessage(), e);
        }
    }

    static void run(String what, Runnable action) {
        call(what, () -> {
            action.run();
            return null;
        });
    }
}
