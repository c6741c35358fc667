package de.bsommerfeld.phrasesync.sync;

import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.domain.SourcePhrase;
import de.bsommerfeld.phrasesync.core.domain.Translation;
import de.bsommerfeld.phrasesync.db.PhraseStore;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reviews what the store already holds, without calling the oracle. Manual
 * translations are never reported as pass-through; a human chose that text.
 */
@Singleton
public class TranslationAuditor {

    private static final Logger LOG = LoggerFactory.getLogger(TranslationAuditor.class);

    private final PhraseStore store;

    @Inject
    public TranslationAuditor(PhraseStore store) {
        this.store = store;
    }

    /**
     * Audits every locale that has stored translations, alphabetically.
     */
    public List<LocaleAudit> auditAll() {
        return audit(new TreeSet<>(store.getLocales()));
    }

    /**
     * @param locales locales to audit, in report order
     * @return one audit per locale
     */
    public List<LocaleAudit> audit(Collection<String> locales) {
        Map<String, String> source = new LinkedHashMap<>();
        for (SourcePhrase phrase : store.getAllSourcePhrases().values()) {
            source.put(phrase.key(), phrase.value());
        }

        List<LocaleAudit> audits = new ArrayList<>(locales.size());
        for (String locale : locales) {
            Map<String, Translation> translations = store.getTranslationsForLocale(locale);
            Map<String, String> automatic = new LinkedHashMap<>();
            Map<String, String> all = new LinkedHashMap<>();
            List<String> orphans = new ArrayList<>();
            translations.forEach((key, translation) -> {
                all.put(key, translation.value());
                if (!translation.isManual()) {
                    automatic.put(key, translation.value());
                }
                if (!source.containsKey(key)) {
                    orphans.add(key);
                }
            });

            LocaleAudit audit = new LocaleAudit(locale, translations.size(),
                    PassThroughCheck.find(source, automatic), PassThroughCheck.findEmpty(source, all), orphans);
            if (audit.hasFindings()) {
                LOG.warn("[{}] {} pass-through, {} empty, {} without source", locale,
                        audit.passThroughKeys().size(), audit.emptyKeys().size(), audit.orphanKeys().size());
            } else {
                LOG.debug("[{}] {} translations look fine", locale, translations.size());
            }
            audits.add(audit);
        }
        return audits;
    }
}
