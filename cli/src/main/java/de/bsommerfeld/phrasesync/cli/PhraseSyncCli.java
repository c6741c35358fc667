package de.bsommerfeld.phrasesync.cli;

import de.bsommerfeld.phrasesync.core.config.SyncConfig;
import de.bsommerfeld.phrasesync.core.event.ApplicationEventBus;
import de.bsommerfeld.phrasesync.sync.LocaleAudit;
import de.bsommerfeld.phrasesync.sync.LocaleReport;
import de.bsommerfeld.phrasesync.sync.MarkResult;
import de.bsommerfeld.phrasesync.sync.OverrideGuard;
import de.bsommerfeld.phrasesync.sync.SyncOrchestrator;
import de.bsommerfeld.phrasesync.sync.SyncReport;
import de.bsommerfeld.phrasesync.sync.TranslationAuditor;
import de.bsommerfeld.phrasesync.sync.bundle.BundleExporter;
import de.bsommerfeld.phrasesync.sync.bundle.BundleImporter;
import de.bsommerfeld.phrasesync.sync.bundle.ImportReport;
import de.bsommerfeld.phrasesync.sync.bundle.PhraseListCodec;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Runs one parsed {@link CommandLine} against the wired services and maps the
 * outcome to a process exit code.
 */
public class PhraseSyncCli {

    private static final Logger LOG = LoggerFactory.getLogger(PhraseSyncCli.class);

    public static final int EXIT_OK = 0;
    /** Finished, but some keys are unresolved or were not found. */
    public static final int EXIT_INCOMPLETE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_FAILURE = 3;

    private final SyncOrchestrator orchestrator;
    private final OverrideGuard overrideGuard;
    private final BundleImporter importer;
    private final BundleExporter exporter;
    private final TranslationAuditor auditor;
    private final ApplicationEventBus eventBus;
    private final SyncConfig syncConfig;
    private final Path workingDir;

    @Inject
    public PhraseSyncCli(SyncOrchestrator orchestrator, OverrideGuard overrideGuard, BundleImporter importer,
            BundleExporter exporter, TranslationAuditor auditor, ApplicationEventBus eventBus,
            SyncConfig syncConfig) {
        this(orchestrator, overrideGuard, importer, exporter, auditor, eventBus, syncConfig, Paths.get(""));
    }

    PhraseSyncCli(SyncOrchestrator orchestrator, OverrideGuard overrideGuard, BundleImporter importer,
            BundleExporter exporter, TranslationAuditor auditor, ApplicationEventBus eventBus,
            SyncConfig syncConfig, Path workingDir) {
        this.orchestrator = orchestrator;
        this.overrideGuard = overrideGuard;
        this.importer = importer;
        this.exporter = exporter;
        this.auditor = auditor;
        this.eventBus = eventBus;
        this.syncConfig = syncConfig;
        this.workingDir = workingDir;
    }

    public int execute(CommandLine line) throws IOException {
        return switch (line.command()) {
            case CommandLine.SYNC -> sync(line.hasFlag("force"), line.locales());
            case CommandLine.MARK_MANUAL -> markManual(line.positional().get(0),
                    line.positional().subList(1, line.positional().size()));
            case CommandLine.IMPORT -> importBundles(folderOrOutput(line),
                    line.source() != null ? line.source() : syncConfig.getSourceLocale());
            case CommandLine.EXPORT -> export(folderOrOutput(line));
            case CommandLine.CONVERT -> convert(resolve(line.positional().get(0)),
                    line.positional().size() > 1 ? resolve(line.positional().get(1))
                            : resolve(syncConfig.getInputFile()));
            case CommandLine.CHECK -> check(line.locales());
            default -> {
                System.out.print(CommandLine.usage());
                yield EXIT_OK;
            }
        };
    }

    int sync(boolean force, List<String> locales) throws IOException {
        Path inputFile = resolve(syncConfig.getInputFile());
        if (!Files.exists(inputFile)) {
            LOG.error("Phrase list not found: {}", inputFile.toAbsolutePath());
            return EXIT_FAILURE;
        }
        Map<String, String> incoming = PhraseListCodec.read(inputFile);
        List<String> targets = locales.isEmpty() ? syncConfig.getTargetLocales() : locales;
        LOG.info("Read {} phrases from {}, target locales {}", incoming.size(), inputFile, targets);

        SyncArtifactWriter writer = new SyncArtifactWriter(resolve(syncConfig.getOutputDir()));
        eventBus.register(writer);
        SyncReport report;
        try {
            report = orchestrator.run(incoming, targets, force);
        } finally {
            eventBus.unregister(writer);
        }

        if (report.isNoChanges()) {
            LOG.info("Nothing to translate.");
            return EXIT_OK;
        }
        for (LocaleReport locale : report.locales()) {
            if (locale.isAborted()) {
                LOG.error("[{}] aborted: {}", locale.locale(), locale.abortedError());
            } else {
                LOG.info("[{}] translated {} ({} retried), manual kept {}, failed {}, pass-through {}",
                        locale.locale(), locale.translated().size(), locale.retriedKeys().size(),
                        locale.skippedManual().size(), locale.failedKeys().size(), locale.passThroughKeys().size());
            }
        }
        if (!writer.getWriteFailures().isEmpty()) {
            return EXIT_FAILURE;
        }
        return report.hasFailures() ? EXIT_INCOMPLETE : EXIT_OK;
    }

    int markManual(String locale, List<String> keys) {
        MarkResult result = overrideGuard.markManual(locale, keys);
        LOG.info("[{}] {} marked as manual, {} not found", locale, result.marked().size(), result.notFound().size());
        for (String key : result.notFound()) {
            LOG.warn("[{}] No translation for '{}'; sync it first", locale, key);
        }
        return result.allMarked() ? EXIT_OK : EXIT_INCOMPLETE;
    }

    int importBundles(Path folder, String sourceLocale) throws IOException {
        ImportReport report = importer.importFolder(folder, sourceLocale);
        LOG.info("Imported {} source phrases and {} translations from {}", report.sourcePhrases(),
                report.totalImported(), folder);
        return report.failedFiles().isEmpty() ? EXIT_OK : EXIT_INCOMPLETE;
    }

    int export(Path folder) throws IOException {
        Map<String, Integer> written = exporter.exportAll(folder);
        LOG.info("Exported {} locales to {}", written.size(), folder);
        return EXIT_OK;
    }

    int convert(Path arbFile, Path phraseList) throws IOException {
        int count = PhraseListCodec.convertFromArb(arbFile, phraseList);
        LOG.info("Converted {} phrases from {} to {}", count, arbFile, phraseList);
        return EXIT_OK;
    }

    int check(List<String> locales) {
        List<LocaleAudit> audits = locales.isEmpty() ? auditor.auditAll() : auditor.audit(locales);
        if (audits.isEmpty()) {
            LOG.info("No translations stored yet.");
            return EXIT_OK;
        }
        boolean findings = false;
        for (LocaleAudit audit : audits) {
            if (!audit.hasFindings()) {
                LOG.info("[{}] {} translations, no issues", audit.locale(), audit.translations());
                continue;
            }
            findings = true;
            logKeys(audit.locale(), "same as source", audit.passThroughKeys());
            logKeys(audit.locale(), "empty", audit.emptyKeys());
            logKeys(audit.locale(), "no source phrase", audit.orphanKeys());
        }
        return findings ? EXIT_INCOMPLETE : EXIT_OK;
    }

    private static void logKeys(String locale, String issue, List<String> keys) {
        for (String key : keys) {
            LOG.warn("[{}] {}: {}", locale, key, issue);
        }
    }

    private Path folderOrOutput(CommandLine line) {
        return resolve(line.positional().isEmpty() ? syncConfig.getOutputDir() : line.positional().get(0));
    }

    private Path resolve(String path) {
        Path p = Paths.get(path);
        return p.isAbsolute() ? p : workingDir.resolve(p);
    }
}
