package de.bsommerfeld.phrasesync.db;

import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.domain.SourcePhrase;
import de.bsommerfeld.phrasesync.core.domain.Translation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * In-memory {@link PhraseStore} for TEST mode and unit tests. Nothing survives
 * the process.
 *
 * <p>
 * Batch writes are applied under the instance lock so readers never observe
 * a half-applied batch. Result ordering matches {@link SqlPhraseStore}
 * (by phrase key).
 */
@Singleton
public class InMemoryPhraseStore implements PhraseStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryPhraseStore.class);

    private final Map<String, SourcePhrase> sourcePhrases = new TreeMap<>();
    private final Map<String, Map<String, Translation>> translationsByLocale = new TreeMap<>();

    public InMemoryPhraseStore() {
        LOG.debug("In-memory phrase store created; nothing will be persisted.");
    }

    @Override
    public synchronized Map<String, SourcePhrase> getAllSourcePhrases() {
        return new LinkedHashMap<>(sourcePhrases);
    }

    @Override
    public synchronized void saveSourcePhrases(List<SourcePhrase> phrases) {
        for (SourcePhrase p : phrases) {
            sourcePhrases.put(p.key(), p);
        }
    }

    @Override
    public synchronized Optional<Translation> getTranslation(String phraseKey, String locale) {
        Map<String, Translation> locales = translationsByLocale.get(locale);
        return locales == null ? Optional.empty() : Optional.ofNullable(locales.get(phraseKey));
    }

    @Override
    public synchronized void saveTranslation(Translation translation) {
        translationsByLocale.computeIfAbsent(translation.locale(), k -> new TreeMap<>())
                .put(translation.phraseKey(), translation);
    }

    @Override
    public synchronized void saveTranslations(List<Translation> translations) {
        translations.forEach(this::saveTranslation);
    }

    @Override
    public synchronized Map<String, Translation> getTranslationsForLocale(String locale) {
        Map<String, Translation> locales = translationsByLocale.get(locale);
        return locales == null ? new LinkedHashMap<>() : new LinkedHashMap<>(locales);
    }

    @Override
    public synchronized Set<String> getLocales() {
        return new TreeSet<>(translationsByLocale.keySet());
    }
}
