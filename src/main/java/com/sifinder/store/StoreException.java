package com.sifinder.store;

/**
 * Failure of the persistent index store: SQLite, file system or locking. Aborts the operation
 * that hit it; records committed before the failure stay intact.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
