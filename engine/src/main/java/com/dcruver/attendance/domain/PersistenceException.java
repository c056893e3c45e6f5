package com.dcruver.attendance.domain;

/**
 * A gallery or ledger store failed to load, save, append or read.
 * In-memory state is left at the last confirmed operation.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceException(String message) {
        super(message);
    }
}
