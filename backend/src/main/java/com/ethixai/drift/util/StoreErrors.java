package com.ethixai.drift.util;

import com.ethixai.drift.exception.TransientStoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.util.Locale;

public final class StoreErrors {

    private StoreErrors() {
    }

    public static boolean isTransient(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException
                || error instanceof DataAccessResourceFailureException;
    }

    /**
     * Returns a {@link TransientStoreException} for failures worth retrying, the original exception otherwise.
     */
    public static RuntimeException translate(String operation, DataAccessException error) {
        if (isTransient(error)) {
            return new TransientStoreException(operation + " failed: " + error.getMostSpecificCause().getMessage(), error);
        }
        return error;
    }

    /**
     * True when the violation is the named unique constraint, as opposed to a value the column cannot hold.
     * Databases report the constraint name in their message; H2 prefixes it with the schema and suffixes the index.
     */
    public static boolean violates(DataIntegrityViolationException error, String constraintName) {
        String needle = constraintName.toLowerCase(Locale.ROOT);
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            String message = cause.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
