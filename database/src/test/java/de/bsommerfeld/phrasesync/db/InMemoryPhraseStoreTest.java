package de.bsommerfeld.phrasesync.db;

import de.bsommerfeld.phrasesync.core.domain.SourcePhrase;
import de.bsommerfeld.phrasesync.core.domain.Translation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPhraseStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    private final InMemoryPhraseStore store = new InMemoryPhraseStore();

    @Test
    void saveSourcePhrases_shouldUpsert() {
        store.saveSourcePhrases(List.of(new SourcePhrase("a", "1", T0)));
        store.saveSourcePhrases(List.of(new SourcePhrase("a", "2", T0)));

        assertEquals("2", store.getAllSourcePhrases().get("a").value());
    }

    @Test
    void getTranslationsForLocale_shouldReturnDefensiveCopy() {
        store.saveTranslation(Translation.automatic("a", "fr", "un", T0));

        Map<String, Translation> copy = store.getTranslationsForLocale("fr");
        copy.clear();

        assertEquals(1, store.getTranslationsForLocale("fr").size());
    }

    @Test
    void isManual_shouldDefaultToFalse() {
        assertFalse(store.isManual("a", "fr"));
        store.saveTranslation(Translation.automatic("a", "fr", "un", T0).asManual(T0));
        assertTrue(store.isManual("a", "fr"));
    }

    @Test
    void getLocales_shouldListLocalesWithTranslations() {
        store.saveTranslations(List.of(
                Translation.automatic("a", "fr", "un", T0),
                Translation.automatic("a", "de", "eins", T0)));

        assertEquals(List.of("de", "fr"), List.copyOf(store.getLocales()));
    }
}
