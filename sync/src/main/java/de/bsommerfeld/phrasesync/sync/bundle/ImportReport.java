package de.bsommerfeld.phrasesync.sync.bundle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link BundleImporter#importFolder}.
 *
 * @param sourcePhrases  phrases recorded from the source-locale bundle
 * @param imported       translations written per locale
 * @param keptManual     manual translations left untouched per locale
 * @param failedFiles    bundle files that could not be read or stored
 */
public record ImportReport(int sourcePhrases, Map<String, Integer> imported, Map<String, Integer> keptManual,
        List<String> failedFiles) {

    public ImportReport {
        imported = Collections.unmodifiableMap(new LinkedHashMap<>(imported));
        keptManual = Collections.unmodifiableMap(new LinkedHashMap<>(keptManual));
        failedFiles = List.copyOf(failedFiles);
    }

    public int totalImported() {
        return imported.values().stream().mapToInt(Integer::intValue).sum();
    }
}
