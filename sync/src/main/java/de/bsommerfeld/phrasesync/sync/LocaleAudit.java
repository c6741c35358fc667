package de.bsommerfeld.phrasesync.sync;

import java.util.List;

/**
 * Findings for the stored translations of one locale.
 *
 * @param locale          audited locale
 * @param translations    number of stored translations
 * @param passThroughKeys automatic translations equal to their source text
 * @param emptyKeys       translations that are blank while the source is not
 * @param orphanKeys      translations without a source phrase
 */
public record LocaleAudit(String locale, int translations, List<String> passThroughKeys, List<String> emptyKeys,
        List<String> orphanKeys) {

    public LocaleAudit {
        passThroughKeys = List.copyOf(passThroughKeys);
        emptyKeys = List.copyOf(emptyKeys);
        orphanKeys = List.copyOf(orphanKeys);
    }

    public boolean hasFindings() {
        return !passThroughKeys.isEmpty() || !emptyKeys.isEmpty() || !orphanKeys.isEmpty();
    }
}
