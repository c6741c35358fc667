package de.bsommerfeld.phrasesync.sync;

import java.util.List;

/**
 * Result of one {@link SyncOrchestrator#run} call.
 *
 * @param deltaSize number of new or changed source phrases (all phrases when
 *                  forced); retried keys are not counted
 * @param forced    whether every incoming phrase was treated as changed
 * @param locales   one report per processed target locale, in processing
 *                  order
 */
public record SyncReport(int deltaSize, boolean forced, List<LocaleReport> locales) {

    public SyncReport {
        locales = List.copyOf(locales);
    }

    public static SyncReport noChanges() {
        return new SyncReport(0, false, List.of());
    }

    public boolean isNoChanges() {
        return deltaSize == 0 && locales.isEmpty();
    }

    public int totalTranslated() {
        return locales.stream().mapToInt(l -> l.translated().size()).sum();
    }

    public int totalFailed() {
        return locales.stream().mapToInt(l -> l.failedKeys().size()).sum();
    }

    public int totalOracleCalls() {
        return locales.stream().mapToInt(LocaleReport::oracleCalls).sum();
    }

    public boolean hasFailures() {
        return locales.stream().anyMatch(LocaleReport::hasFailures);
    }
}
