package de.bsommerfeld.phrasesync.translator;

/**
 * The provider rejected the request because of throttling (HTTP 429). Unlike
 * its parent, this condition is retried with exponential backoff.
 */
public class RateLimitedException extends OracleException {

    private final String responseBody;

    public RateLimitedException(String message, String responseBody) {
        super(message);
        this.responseBody = responseBody;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
