package de.bsommerfeld.phrasesync.db;

/**
 * Durable-state I/O failure. Fatal to the operation that triggered it, but
 * not to the process: the sync engine aborts the current run or locale and
 * lets the caller decide how to continue.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
