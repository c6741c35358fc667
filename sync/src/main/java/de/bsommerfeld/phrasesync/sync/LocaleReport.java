package de.bsommerfeld.phrasesync.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of syncing one target locale.
 *
 * @param locale           target locale
 * @param translated       keys translated and stored during this run
 * @param failedKeys       keys the oracle could not translate
 * @param skippedManual    changed keys left alone because their translation
 *                         is manual
 * @param passThroughKeys  keys whose translation equals the source text
 * @param retriedKeys      unchanged keys sent to the oracle again because
 *                         their translation was missing or older than the
 *                         source phrase
 * @param bundle           every stored translation of the locale after the
 *                         run, ordered by key
 * @param oracleCalls      oracle invocations spent on this locale
 * @param abortedError     storage error that stopped this locale, or
 *                         {@code null}
 */
public record LocaleReport(
        String locale,
        List<String> translated,
        List<String> failedKeys,
        List<String> skippedManual,
        List<String> passThroughKeys,
        List<String> retriedKeys,
        Map<String, String> bundle,
        int oracleCalls,
        String abortedError) {

    public LocaleReport {
        translated = List.copyOf(translated);
        failedKeys = List.copyOf(failedKeys);
        skippedManual = List.copyOf(skippedManual);
        passThroughKeys = List.copyOf(passThroughKeys);
        retriedKeys = List.copyOf(retriedKeys);
        bundle = Collections.unmodifiableMap(new LinkedHashMap<>(bundle));
    }

    static LocaleReport aborted(String locale, List<String> translated, int oracleCalls, String error) {
        return new LocaleReport(locale, translated, List.of(), List.of(), List.of(), List.of(), Map.of(),
                oracleCalls, error);
    }

    public boolean isAborted() {
        return abortedError != null;
    }

    public boolean hasFailures() {
        return isAborted() || !failedKeys.isEmpty();
    }
}
