package de.bsommerfeld.phrasesync.translator;

/**
 * The translation provider failed to translate a request. Not retried within
 * a run; the affected phrases are recorded as failed and picked up again by
 * the next run's diff.
 */
public class OracleException extends Exception {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
