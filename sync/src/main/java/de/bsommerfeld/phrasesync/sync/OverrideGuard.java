package de.bsommerfeld.phrasesync.sync;

import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.domain.Translation;
import de.bsommerfeld.phrasesync.db.PhraseStore;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Protects human-corrected translations from the sync path.
 *
 * <p>
 * Provenance lives on the stored {@link Translation}; this class only reads
 * and flips it. The flip is one-way ({@code AUTOMATIC -> MANUAL}) and never
 * touches the translated value.
 */
@Singleton
public class OverrideGuard {

    private static final Logger LOG = LoggerFactory.getLogger(OverrideGuard.class);

    private final PhraseStore store;
    private final Clock clock;

    @Inject
    public OverrideGuard(PhraseStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public boolean isManual(String phraseKey, String locale) {
        return store.isManual(phraseKey, locale);
    }

    /**
     * Returns the subset of {@code phraseKeys} that is protected in
     * {@code locale}, preserving the order of {@code phraseKeys}. Reads the
     * locale's translations once instead of once per key.
     */
    public Set<String> manualKeys(String locale, Collection<String> phraseKeys) {
        Map<String, Translation> existing = store.getTranslationsForLocale(locale);
        Set<String> manual = new LinkedHashSet<>();
        for (String key : phraseKeys) {
            Translation t = existing.get(key);
            if (t != null && t.isManual()) {
                manual.add(key);
            }
        }
        return manual;
    }

    /**
     * Marks an existing translation as manual. Idempotent: marking an
     * already-manual translation again succeeds and keeps the value.
     *
     * @return the stored, now manual translation
     * @throws ManualTargetNotFoundException if the phrase was never translated
     *                                       into {@code locale}
     */
    public Translation markManual(String phraseKey, String locale) throws ManualTargetNotFoundException {
        Translation existing = store.getTranslation(phraseKey, locale)
                .orElseThrow(() -> new ManualTargetNotFoundException(phraseKey, locale));

        Translation manual = existing.asManual(clock.instant());
        store.saveTranslation(manual);
        LOG.info("Marked as manual: {} [{}]", phraseKey, locale);
        return manual;
    }

    /**
     * Operator-facing batch form. Missing translations are collected instead of
     * aborting the remaining keys.
     */
    public MarkResult markManual(String locale, List<String> phraseKeys) {
        List<String> marked = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String key : phraseKeys) {
            try {
                markManual(key, locale);
                marked.add(key);
            } catch (ManualTargetNotFoundException e) {
                LOG.warn("Translation not found: {} [{}]", key, locale);
                notFound.add(key);
            }
        }
        return new MarkResult(locale, marked, notFound);
    }
}
