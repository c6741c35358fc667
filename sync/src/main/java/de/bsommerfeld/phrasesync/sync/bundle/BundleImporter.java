package de.bsommerfeld.phrasesync.sync.bundle;

import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.domain.SourcePhrase;
import de.bsommerfeld.phrasesync.core.domain.Translation;
import de.bsommerfeld.phrasesync.core.util.LocaleNames;
import de.bsommerfeld.phrasesync.db.PhraseStore;
import de.bsommerfeld.phrasesync.db.StorageException;
import de.bsommerfeld.phrasesync.sync.OverrideGuard;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Seeds the store from a folder of existing {@code app_<locale>.arb} bundles.
 *
 * <p>
 * The source-locale bundle becomes the source catalog, so a following sync
 * only translates what changed afterwards. Every other bundle is stored as
 * automatic translations, except where a manual translation already exists.
 * Error artifacts ({@code app_errors_*}) are ignored. A bundle that cannot be
 * read or stored is reported and the import continues with the next one.
 */
@Singleton
public class BundleImporter {

    private static final Logger LOG = LoggerFactory.getLogger(BundleImporter.class);

    private final PhraseStore store;
    private final OverrideGuard overrideGuard;
    private final Clock clock;

    @Inject
    public BundleImporter(PhraseStore store, OverrideGuard overrideGuard, Clock clock) {
        this.store = store;
        this.overrideGuard = overrideGuard;
        this.clock = clock;
    }

    /**
     * @throws IOException if the folder cannot be listed or holds no source
     *                     bundle for {@code sourceLocale}
     */
    public ImportReport importFolder(Path folder, String sourceLocale) throws IOException {
        Map<String, Path> bundles = findBundles(folder);
        Path sourceFile = bundles.remove(sourceLocale);
        if (sourceFile == null) {
            throw new IOException("No " + LocaleNames.bundleFileName(sourceLocale) + " in " + folder);
        }

        Instant now = clock.instant();
        Map<String, String> source = ArbCodec.read(sourceFile);
        List<SourcePhrase> phrases = new ArrayList<>(source.size());
        source.forEach((key, value) -> phrases.add(new SourcePhrase(key, value, now)));
        store.saveSourcePhrases(phrases);
        LOG.info("Imported {} source phrases from {}", phrases.size(), sourceFile.getFileName());

        Map<String, Integer> imported = new LinkedHashMap<>();
        Map<String, Integer> keptManual = new LinkedHashMap<>();
        List<String> failedFiles = new ArrayList<>();

        for (Map.Entry<String, Path> bundle : bundles.entrySet()) {
            String locale = bundle.getKey();
            Path file = bundle.getValue();
            try {
                Map<String, String> values = ArbCodec.read(file);
                Set<String> manual = overrideGuard.manualKeys(locale, values.keySet());
                List<Translation> translations = new ArrayList<>();
                values.forEach((key, value) -> {
                    if (!manual.contains(key)) {
                        translations.add(Translation.automatic(key, locale, value, now));
                    }
                });
                store.saveTranslations(translations);
                imported.put(locale, translations.size());
                keptManual.put(locale, manual.size());
                LOG.info("[{}] Imported {} translations, kept {} manual", locale, translations.size(),
                        manual.size());
            } catch (IOException | StorageException e) {
                LOG.error("Failed to import {}", file.getFileName(), e);
                failedFiles.add(file.getFileName().toString());
            }
        }
        return new ImportReport(phrases.size(), imported, keptManual, failedFiles);
    }

    /**
     * Bundle files keyed by locale, in file name order.
     */
    private static Map<String, Path> findBundles(Path folder) throws IOException {
        Map<String, Path> bundles = new LinkedHashMap<>();
        try (Stream<Path> files = Files.list(folder)) {
            files.filter(Files::isRegularFile)
                    .sorted()
                    .forEach(file -> {
                        String name = file.getFileName().toString();
                        if (name.contains("error")) {
                            LOG.debug("Skipping error artifact {}", name);
                            return;
                        }
                        String locale = LocaleNames.localeFromBundleFileName(name);
                        if (locale != null) {
                            bundles.put(locale, file);
                        }
                    });
        }
        return bundles;
    }
}
