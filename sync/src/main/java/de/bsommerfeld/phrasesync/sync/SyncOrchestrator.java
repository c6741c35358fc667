package de.bsommerfeld.phrasesync.sync;

import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.config.SyncConfig;
import de.bsommerfeld.phrasesync.core.diff.DiffEngine;
import de.bsommerfeld.phrasesync.core.domain.SourcePhrase;
import de.bsommerfeld.phrasesync.core.domain.Translation;
import de.bsommerfeld.phrasesync.core.event.ApplicationEventBus;
import de.bsommerfeld.phrasesync.db.PhraseStore;
import de.bsommerfeld.phrasesync.db.StorageException;
import de.bsommerfeld.phrasesync.sync.SyncEvents.LocaleSyncedEvent;
import de.bsommerfeld.phrasesync.sync.SyncEvents.SyncCompletedEvent;
import de.bsommerfeld.phrasesync.sync.bundle.ArbCodec;
import de.bsommerfeld.phrasesync.translator.BatchResult;
import de.bsommerfeld.phrasesync.translator.BatchTranslator;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one incremental sync: diff the incoming source phrases against the
 * store, translate only what changed into every target locale, and rebuild
 * each locale's bundle from the store.
 *
 * <p>
 * Unchanged phrases are sent again when a locale has no translation for them,
 * or only an automatic one older than the stored source phrase. That covers
 * chunks that failed in an earlier run and locales added after the phrase.
 *
 * <p>
 * Failure scope:
 * <ul>
 * <li>A storage failure while reading the locales' translations or recording
 * the changed source phrases aborts the run. Nothing has been translated at
 * that point.</li>
 * <li>A storage failure inside a locale aborts that locale only. Chunks
 * committed before the failure stay committed.</li>
 * <li>Oracle failures never abort anything; the affected keys are reported.</li>
 * </ul>
 * Locales and chunks are processed strictly in order on the calling thread.
 */
@Singleton
public class SyncOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final PhraseStore store;
    private final OverrideGuard overrideGuard;
    private final BatchTranslator batchTranslator;
    private final ApplicationEventBus eventBus;
    private final SyncConfig syncConfig;
    private final Clock clock;

    @Inject
    public SyncOrchestrator(PhraseStore store, OverrideGuard overrideGuard, BatchTranslator batchTranslator,
            ApplicationEventBus eventBus, SyncConfig syncConfig, Clock clock) {
        this.store = store;
        this.overrideGuard = overrideGuard;
        this.batchTranslator = batchTranslator;
        this.eventBus = eventBus;
        this.syncConfig = syncConfig;
        this.clock = clock;
    }

    /**
     * Syncs {@code incoming} into every locale of {@code targetLocales}.
     *
     * @param incoming      source phrases keyed by phrase key; metadata keys
     *                      are ignored
     * @param targetLocales locales to translate into, processed in order
     * @param force         treat every incoming phrase as changed
     * @throws StorageException if the stored translations cannot be read or
     *                          the changed source phrases cannot be recorded
     */
    public SyncReport run(Map<String, String> incoming, List<String> targetLocales, boolean force) {
        Map<String, String> phrases = withoutMetadata(incoming);
        String sourceLocale = syncConfig.getSourceLocale();

        Map<String, SourcePhrase> stored = store.getAllSourcePhrases();
        List<Map.Entry<String, String>> delta = DiffEngine.computeDelta(phrases, stored, force);

        Set<String> changed = new HashSet<>();
        delta.forEach(e -> changed.add(e.getKey()));
        Map<String, List<Map.Entry<String, String>>> retries = new LinkedHashMap<>();
        for (String locale : targetLocales) {
            if (!locale.equals(sourceLocale)) {
                retries.put(locale, staleEntries(locale, phrases, stored, changed));
            }
        }
        int retryCount = retries.values().stream().mapToInt(List::size).sum();

        if (delta.isEmpty() && retryCount == 0) {
            LOG.info("No new or changed phrases ({} known)", stored.size());
            SyncReport report = SyncReport.noChanges();
            eventBus.post(new SyncCompletedEvent(report));
            return report;
        }

        if (delta.isEmpty()) {
            LOG.info("No new or changed phrases, retrying {} incomplete translations", retryCount);
        } else {
            LOG.info("{} of {} phrases need translation{}", delta.size(), phrases.size(), force ? " (forced)" : "");
            store.saveSourcePhrases(toSourcePhrases(delta, clock.instant()));
        }

        List<LocaleReport> reports = new ArrayList<>();
        for (String locale : targetLocales) {
            if (locale.equals(sourceLocale)) {
                LOG.warn("Skipping target locale {}: it is the source locale", locale);
                continue;
            }
            LocaleReport report = syncLocale(sourceLocale, locale, phrases, delta, retries.get(locale));
            reports.add(report);
            eventBus.post(new LocaleSyncedEvent(report));
        }

        SyncReport report = new SyncReport(delta.size(), force, reports);
        LOG.info("Sync finished: {} translated, {} unresolved, {} oracle calls", report.totalTranslated(),
                report.totalFailed(), report.totalOracleCalls());
        eventBus.post(new SyncCompletedEvent(report));
        return report;
    }

    /**
     * Unchanged incoming phrases whose translation in {@code locale} is
     * missing, or automatic and older than the stored source phrase.
     */
    private List<Map.Entry<String, String>> staleEntries(String locale, Map<String, String> phrases,
            Map<String, SourcePhrase> stored, Set<String> changed) {
        Map<String, Translation> translations = store.getTranslationsForLocale(locale);
        List<Map.Entry<String, String>> stale = new ArrayList<>();
        phrases.forEach((key, value) -> {
            if (changed.contains(key)) {
                return;
            }
            Translation translation = translations.get(key);
            if (translation == null) {
                stale.add(Map.entry(key, value));
            } else if (!translation.isManual()
                    && translation.lastUpdated().isBefore(stored.get(key).lastUpdated())) {
                stale.add(Map.entry(key, value));
            }
        });
        return stale;
    }

    private LocaleReport syncLocale(String sourceLocale, String locale, Map<String, String> phrases,
            List<Map.Entry<String, String>> delta, List<Map.Entry<String, String>> retry) {
        List<String> translated = new ArrayList<>();
        BatchResult result = null;
        try {
            Set<String> manual = overrideGuard.manualKeys(locale,
                    delta.stream().map(Map.Entry::getKey).toList());
            List<Map.Entry<String, String>> toTranslate = new ArrayList<>();
            for (Map.Entry<String, String> entry : delta) {
                if (!manual.contains(entry.getKey())) {
                    toTranslate.add(entry);
                }
            }
            toTranslate.addAll(retry);
            if (!manual.isEmpty()) {
                LOG.info("[{}] Keeping {} manual translations", locale, manual.size());
            }
            List<String> retried = retry.stream().map(Map.Entry::getKey).toList();
            if (!retried.isEmpty()) {
                LOG.info("[{}] Retrying {} unchanged phrases without a current translation", locale,
                        retried.size());
            }

            result = batchTranslator.translateBatches(sourceLocale, locale, toTranslate, chunk -> {
                store.saveTranslations(toTranslations(chunk, locale, clock.instant()));
                translated.addAll(chunk.keySet());
            });

            List<String> passThrough = syncConfig.isFlagPassThrough()
                    ? PassThroughCheck.find(phrases, result.merged())
                    : List.of();
            if (!passThrough.isEmpty()) {
                LOG.warn("[{}] {} translations equal their source text: {}", locale, passThrough.size(),
                        passThrough);
            }
            if (result.hasFailures()) {
                LOG.warn("[{}] {} phrases could not be translated; the next sync retries them", locale,
                        result.failedKeys().size());
            }

            Map<String, String> bundle = bundleOf(store.getTranslationsForLocale(locale));
            LOG.info("[{}] {} translated, {} manual kept, bundle holds {} phrases", locale, translated.size(),
                    manual.size(), bundle.size());
            return new LocaleReport(locale, translated, result.failedKeys(), new ArrayList<>(manual), passThrough,
                    retried, bundle, result.oracleCalls(), null);
        } catch (StorageException e) {
            LOG.error("[{}] Storage failure, locale aborted after {} translations", locale, translated.size(), e);
            int calls = result != null ? result.oracleCalls() : 0;
            return LocaleReport.aborted(locale, translated, calls, e.getMessage());
        }
    }

    private static Map<String, String> withoutMetadata(Map<String, String> incoming) {
        Map<String, String> phrases = new LinkedHashMap<>();
        incoming.forEach((key, value) -> {
            if (!key.startsWith(ArbCodec.METADATA_PREFIX)) {
                phrases.put(key, value);
            }
        });
        return phrases;
    }

    private static List<SourcePhrase> toSourcePhrases(List<Map.Entry<String, String>> delta, Instant now) {
        List<SourcePhrase> list = new ArrayList<>(delta.size());
        for (Map.Entry<String, String> e : delta) {
            list.add(new SourcePhrase(e.getKey(), e.getValue(), now));
        }
        return list;
    }

    private static List<Translation> toTranslations(Map<String, String> chunk, String locale, Instant now) {
        List<Translation> list = new ArrayList<>(chunk.size());
        chunk.forEach((key, value) -> list.add(Translation.automatic(key, locale, value, now)));
        return list;
    }

    private static Map<String, String> bundleOf(Map<String, Translation> translations) {
        Map<String, String> bundle = new LinkedHashMap<>();
        translations.forEach((key, t) -> bundle.put(key, t.value()));
        return bundle;
    }
}
