package de.bsommerfeld.phrasesync.core.diff;

import de.bsommerfeld.phrasesync.core.domain.SourcePhrase;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Change detection between an incoming source catalog and the source phrases
 * recorded in the store.
 *
 * <p>
 * The delta is computed once per run against the canonical store and is
 * independent of any target locale. Both methods are pure: they neither read
 * nor write state beyond their arguments.
 */
public final class DiffEngine {

    private DiffEngine() {
    }

    /**
     * Returns the incoming entries whose key is unknown to the store or whose
     * value differs from the stored value, in the iteration order of
     * {@code incoming}. The order of {@code stored} is irrelevant.
     */
    public static List<Map.Entry<String, String>> computeDelta(Map<String, String> incoming,
            Map<String, SourcePhrase> stored) {
        return computeDelta(incoming, stored, false);
    }

    /**
     * Same as {@link #computeDelta(Map, Map)}, but returns every incoming entry
     * when {@code forceAll} is set. Used for full retranslation runs.
     */
    public static List<Map.Entry<String, String>> computeDelta(Map<String, String> incoming,
            Map<String, SourcePhrase> stored, boolean forceAll) {
        List<Map.Entry<String, String>> delta = new ArrayList<>();
        for (Map.Entry<String, String> entry : incoming.entrySet()) {
            if (forceAll || isNewOrChanged(entry, stored)) {
                delta.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
            }
        }
        return delta;
    }

    private static boolean isNewOrChanged(Map.Entry<String, String> entry, Map<String, SourcePhrase> stored) {
        SourcePhrase known = stored.get(entry.getKey());
        return known == null || !known.value().equals(entry.getValue());
    }
}
