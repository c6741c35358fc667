package de.bsommerfeld.phrasesync.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A translated value of one phrase for one locale, keyed by
 * {@code (phraseKey, locale)}.
 *
 * <p>
 * Records are immutable. Marking a translation as manual produces a new
 * record via {@link #asManual(Instant)} that keeps the value untouched.
 */
public record Translation(String phraseKey, String locale, String value,
        Provenance provenance, Instant lastUpdated) {

    public Translation {
        Objects.requireNonNull(phraseKey, "phraseKey");
        Objects.requireNonNull(locale, "locale");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(provenance, "provenance");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    public static Translation automatic(String phraseKey, String locale, String value, Instant now) {
        return new Translation(phraseKey, locale, value, Provenance.AUTOMATIC, now);
    }

    public boolean isManual() {
        return provenance == Provenance.MANUAL;
    }

    public Translation asManual(Instant now) {
        return new Translation(phraseKey, locale, value, Provenance.MANUAL, now);
    }
}
