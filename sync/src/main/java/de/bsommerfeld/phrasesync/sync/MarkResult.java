package de.bsommerfeld.phrasesync.sync;

import java.util.List;

/**
 * Outcome of marking several phrases of one locale as manual.
 *
 * @param locale   the locale the keys were marked in
 * @param marked   keys now protected, in request order
 * @param notFound keys without an existing translation, in request order
 */
public record MarkResult(String locale, List<String> marked, List<String> notFound) {

    public MarkResult {
        marked = List.copyOf(marked);
        notFound = List.copyOf(notFound);
    }

    public boolean allMarked() {
        return notFound.isEmpty();
    }
}
