package de.bsommerfeld.phrasesync.sync.bundle;

import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.domain.Translation;
import de.bsommerfeld.phrasesync.core.util.LocaleNames;
import de.bsommerfeld.phrasesync.db.PhraseStore;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Writes stored translations back out as {@code app_<locale>.arb} files.
 */
@Singleton
public class BundleExporter {

    private static final Logger LOG = LoggerFactory.getLogger(BundleExporter.class);

    private final PhraseStore store;

    @Inject
    public BundleExporter(PhraseStore store) {
        this.store = store;
    }

    /**
     * Exports every locale that holds at least one translation.
     *
     * @return phrases written per locale, in locale order
     */
    public Map<String, Integer> exportAll(Path outputDir) throws IOException {
        return export(outputDir, new TreeSet<>(store.getLocales()));
    }

    /**
     * Exports the given locales. Locales without translations produce no file.
     */
    public Map<String, Integer> export(Path outputDir, Collection<String> locales) throws IOException {
        Files.createDirectories(outputDir);
        Map<String, Integer> written = new LinkedHashMap<>();
        for (String locale : locales) {
            Map<String, String> bundle = bundle(locale);
            if (bundle.isEmpty()) {
                LOG.info("[{}] No translations, nothing exported", locale);
                continue;
            }
            Path file = outputDir.resolve(LocaleNames.bundleFileName(locale));
            ArbCodec.write(file, bundle);
            LOG.info("[{}] Exported {} phrases to {}", locale, bundle.size(), file);
            written.put(locale, bundle.size());
        }
        return written;
    }

    /**
     * Writes a locale's keys that could not be translated, one per line. An
     * empty key list removes a stale file from a previous run.
     */
    public static void writeErrorFile(Path outputDir, String locale, List<String> keys) throws IOException {
        Path file = outputDir.resolve(LocaleNames.errorFileName(locale));
        if (keys.isEmpty()) {
            Files.deleteIfExists(file);
            return;
        }
        Files.createDirectories(outputDir);
        Files.write(file, keys);
    }

    private Map<String, String> bundle(String locale) {
        Map<String, String> bundle = new LinkedHashMap<>();
        for (Map.Entry<String, Translation> e : store.getTranslationsForLocale(locale).entrySet()) {
            bundle.put(e.getKey(), e.getValue().value());
        }
        return bundle;
    }
}
