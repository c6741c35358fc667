package de.bsommerfeld.phrasesync.cli;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.phrasesync.core.util.LocaleNames;
import de.bsommerfeld.phrasesync.sync.LocaleReport;
import de.bsommerfeld.phrasesync.sync.SyncEvents.LocaleSyncedEvent;
import de.bsommerfeld.phrasesync.sync.bundle.ArbCodec;
import de.bsommerfeld.phrasesync.sync.bundle.BundleExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes {@code app_<locale>.arb} and {@code app_errors_<locale>.txt} as
 * locales finish syncing. Aborted locales keep their previous files.
 *
 * <p>
 * Write failures are collected instead of thrown, since the event bus would
 * only log them. Callers check {@link #getWriteFailures()} after the run.
 */
public class SyncArtifactWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SyncArtifactWriter.class);

    private final Path outputDir;
    private final List<String> writeFailures = new ArrayList<>();

    public SyncArtifactWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Subscribe
    public void onLocaleSynced(LocaleSyncedEvent event) {
        LocaleReport report = event.report();
        String locale = report.locale();
        if (report.isAborted()) {
            LOG.warn("[{}] Aborted, bundle not written: {}", locale, report.abortedError());
            return;
        }
        try {
            Path bundle = outputDir.resolve(LocaleNames.bundleFileName(locale));
            ArbCodec.write(bundle, report.bundle());
            BundleExporter.writeErrorFile(outputDir, locale, report.failedKeys());
            if (report.failedKeys().isEmpty()) {
                LOG.info("[{}] Wrote {}", locale, bundle.getFileName());
            } else {
                LOG.warn("[{}] Wrote {} and {} with {} unresolved keys", locale, bundle.getFileName(),
                        LocaleNames.errorFileName(locale), report.failedKeys().size());
            }
        } catch (IOException e) {
            LOG.error("[{}] Failed to write artifacts to {}", locale, outputDir, e);
            writeFailures.add(locale);
        }
    }

    public List<String> getWriteFailures() {
        return List.copyOf(writeFailures);
    }
}
