package de.bsommerfeld.phrasesync.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A phrase of the canonical source-language catalog as recorded by the store.
 * One record exists per key. The value and timestamp change whenever the
 * source text changes; records are never deleted by a sync run.
 *
 * @param key         stable identifier of the translatable unit
 * @param value       source-language text
 * @param lastUpdated when the value was last written to the store
 */
public record SourcePhrase(String key, String value, Instant lastUpdated) {

    public SourcePhrase {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }
}
