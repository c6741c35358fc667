package de.bsommerfeld.phrasesync.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds translations that came back identical to their source text. Usually
 * the oracle did not recognize the phrase; sometimes the text is simply the
 * same in both languages ({@code "OK"}, brand names). Results are reported,
 * never rejected.
 */
public final class PassThroughCheck {

    private PassThroughCheck() {
    }

    /**
     * @param source     source values keyed by phrase key
     * @param translated translated values keyed by phrase key
     * @return keys whose translation equals the source value, in the order of
     *         {@code translated}
     */
    public static List<String> find(Map<String, String> source, Map<String, String> translated) {
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, String> entry : translated.entrySet()) {
            String original = source.get(entry.getKey());
            if (original != null && !original.isBlank() && original.equals(entry.getValue())) {
                keys.add(entry.getKey());
            }
        }
        return keys;
    }

    /**
     * @param source     source values keyed by phrase key
     * @param translated translated values keyed by phrase key
     * @return keys with a non-blank source value but a blank translation, in
     *         the order of {@code translated}
     */
    public static List<String> findEmpty(Map<String, String> source, Map<String, String> translated) {
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, String> entry : translated.entrySet()) {
            String original = source.get(entry.getKey());
            String value = entry.getValue();
            if (original != null && !original.isBlank() && (value == null || value.isBlank())) {
                keys.add(entry.getKey());
            }
        }
        return keys;
    }
}
