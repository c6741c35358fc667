package de.bsommerfeld.phrasesync.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

public class TranslatorConfig {

    @JsonProperty("endpoint")
    private String endpoint = "https://api.cognitive.microsofttranslator.com";

    @JsonProperty("region")
    private String region = "westeurope";

    /** Empty means: fall back to PHRASESYNC_API_KEY or secret.txt. */
    @JsonProperty("api-key")
    private String apiKey = "";

    @JsonProperty("batch-size")
    private int batchSize = 100;

    @JsonProperty("max-retries")
    private int maxRetries = 3;

    @JsonProperty("backoff-base-seconds")
    private long backoffBaseSeconds = 10;

    @JsonProperty("batch-pause-seconds")
    private long batchPauseSeconds = 3;

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 60;

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBackoffBaseSeconds() {
        return backoffBaseSeconds;
    }

    public void setBackoffBaseSeconds(long backoffBaseSeconds) {
        this.backoffBaseSeconds = backoffBaseSeconds;
    }

    public long getBatchPauseSeconds() {
        return batchPauseSeconds;
    }

    public void setBatchPauseSeconds(long batchPauseSeconds) {
        this.batchPauseSeconds = batchPauseSeconds;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(long requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public Duration backoffBase() {
        return Duration.ofSeconds(backoffBaseSeconds);
    }

    public Duration batchPause() {
        return Duration.ofSeconds(batchPauseSeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }
}
