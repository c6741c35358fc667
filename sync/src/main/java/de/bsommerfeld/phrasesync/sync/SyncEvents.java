package de.bsommerfeld.phrasesync.sync;

/**
 * Events posted by {@link SyncOrchestrator} on the application event bus.
 */
public final class SyncEvents {

    private SyncEvents() {
    }

    /** A target locale finished, successfully or aborted. */
    public record LocaleSyncedEvent(LocaleReport report) {
    }

    /** The whole run finished. Not posted when the run itself aborts. */
    public record SyncCompletedEvent(SyncReport report) {
    }
}
