package de.bsommerfeld.phrasesync.cli;

import de.bsommerfeld.phrasesync.sync.LocaleReport;
import de.bsommerfeld.phrasesync.sync.SyncEvents.LocaleSyncedEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncArtifactWriterTest {

    @TempDir
    Path outputDir;

    @Test
    void onLocaleSynced_shouldWriteBundleAndErrorFile() throws IOException {
        SyncArtifactWriter writer = new SyncArtifactWriter(outputDir);

        writer.onLocaleSynced(new LocaleSyncedEvent(new LocaleReport("fr", List.of("greeting"), List.of("farewell"),
                List.of(), List.of(), List.of(), Map.of("greeting", "Bonjour"), 1, null)));

        assertTrue(Files.readString(outputDir.resolve("app_fr.arb")).contains("\"greeting\": \"Bonjour\""));
        assertEquals(List.of("farewell"), Files.readAllLines(outputDir.resolve("app_errors_fr.txt")));
        assertTrue(writer.getWriteFailures().isEmpty());
    }

    @Test
    void onLocaleSynced_shouldLeaveFilesOfAbortedLocale() throws IOException {
        Files.writeString(outputDir.resolve("app_fr.arb"), "{\"greeting\": \"Bonjour\"}");
        SyncArtifactWriter writer = new SyncArtifactWriter(outputDir);

        writer.onLocaleSynced(new LocaleSyncedEvent(new LocaleReport("fr", List.of(), List.of(), List.of(),
                List.of(), List.of(), Map.of(), 0, "locked")));

        assertEquals("{\"greeting\": \"Bonjour\"}", Files.readString(outputDir.resolve("app_fr.arb")));
    }

    @Test
    void onLocaleSynced_shouldRecordWriteFailures() throws IOException {
        Path blocked = Files.writeString(outputDir.resolve("blocked"), "file, not a directory");
        SyncArtifactWriter writer = new SyncArtifactWriter(blocked);

        writer.onLocaleSynced(new LocaleSyncedEvent(new LocaleReport("fr", List.of(), List.of(), List.of(),
                List.of(), List.of(), Map.of("greeting", "Bonjour"), 0, null)));

        assertEquals(List.of("fr"), writer.getWriteFailures());
    }
}
