package de.bsommerfeld.phrasesync.db;

import de.bsommerfeld.phrasesync.core.domain.SourcePhrase;
import de.bsommerfeld.phrasesync.core.domain.Translation;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence contract for the source catalog and its per-locale
 * translations. Owns all durable state of the sync engine.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlPhraseStore}: production persistence via SQLite</li>
 * <li>{@link InMemoryPhraseStore}: map-backed store for TEST mode, no disk
 * I/O</li>
 * </ul>
 *
 * <p>
 * Every mutating call is durable before it returns. Failures surface as
 * {@link StorageException}.
 */
public interface PhraseStore {

    /**
     * Returns every recorded source phrase keyed by phrase key.
     */
    Map<String, SourcePhrase> getAllSourcePhrases();

    /**
     * Upserts all given phrases in a single transaction. Either every record
     * becomes visible or none does.
     */
    void saveSourcePhrases(List<SourcePhrase> phrases);

    /**
     * Returns the translation for {@code (phraseKey, locale)}, or empty if the
     * phrase has never been translated into that locale.
     */
    Optional<Translation> getTranslation(String phraseKey, String locale);

    /**
     * Convenience check derived from the provenance field. {@code false} when
     * no translation exists.
     */
    default boolean isManual(String phraseKey, String locale) {
        return getTranslation(phraseKey, locale).map(Translation::isManual).orElse(false);
    }

    /**
     * Upserts a single translation.
     */
    void saveTranslation(Translation translation);

    /**
     * Upserts translations grouped by locale. Each locale's group is committed
     * as one transaction; no atomicity is provided across locales, so a
     * failure in a later locale leaves earlier ones committed.
     */
    void saveTranslations(List<Translation> translations);

    /**
     * Returns all translations held for a locale, ordered by phrase key.
     */
    Map<String, Translation> getTranslationsForLocale(String locale);

    /**
     * Returns every locale holding at least one translation.
     */
    Set<String> getLocales();
}
