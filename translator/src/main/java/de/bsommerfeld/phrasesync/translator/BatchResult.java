package de.bsommerfeld.phrasesync.translator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link BatchTranslator#translateBatches}: every input key ends
 * up either in {@link #merged()} or in {@link #failedKeys()}, never both and
 * never neither.
 *
 * @param merged      translated values keyed by phrase key, in input order
 * @param failedKeys  keys of every chunk that could not be translated, in
 *                    input order
 * @param oracleCalls number of oracle invocations, retries included
 */
public record BatchResult(Map<String, String> merged, List<String> failedKeys, int oracleCalls) {

    public BatchResult {
        merged = Collections.unmodifiableMap(new LinkedHashMap<>(merged));
        failedKeys = List.copyOf(failedKeys);
    }

    public static BatchResult empty() {
        return new BatchResult(Map.of(), List.of(), 0);
    }

    public boolean hasFailures() {
        return !failedKeys.isEmpty();
    }
}
