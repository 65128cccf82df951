package com.nicolaswinsten.lootsync.error;

/**
 * The store stayed busy through every retry, or the writer could not get its turn in time.
 * Callers may try again later.
 */
public class StorageBusyException extends WorldStateException {

    public StorageBusyException(String message) {
        super(ErrorKind.TRANSIENT_STORAGE_BUSY, message);
    }

    public StorageBusyException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_STORAGE_BUSY, message, cause);
    }
}
