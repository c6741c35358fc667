package de.bsommerfeld.phrasesync.sync.bundle;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArbCodecTest {

    @TempDir
    Path tempDir;

    @Test
    void decode_shouldSkipMetadataAndKeepOrder() throws IOException {
        String json = """
                {
                  "greeting": "Hello",
                  "@greeting": {"description": "Shown on start"},
                  "farewell": "Goodbye",
                  "count": 3
                }
                """;

        Map<String, String> phrases = ArbCodec.decode(json);

        assertEquals(List.of("greeting", "farewell", "count"), List.copyOf(phrases.keySet()));
        assertEquals("3", phrases.get("count"));
    }

    @Test
    void decode_shouldRejectNonObject() {
        assertThrows(IOException.class, () -> ArbCodec.decode("[1, 2]"));
    }

    @Test
    void encode_shouldUseTwoSpaceIndent() throws IOException {
        Map<String, String> phrases = new LinkedHashMap<>();
        phrases.put("greeting", "Bonjour");
        phrases.put("@@locale", "fr");
        phrases.put("farewell", "Au revoir");

        String json = ArbCodec.encode(phrases);

        assertEquals("{\n  \"greeting\": \"Bonjour\",\n  \"farewell\": \"Au revoir\"\n}", json);
    }

    @Test
    void write_shouldCreateParentDirectories() throws IOException {
        Path file = tempDir.resolve("out/nested/app_fr.arb");

        ArbCodec.write(file, Map.of("greeting", "Bonjour"));

        assertTrue(Files.exists(file));
        assertEquals(Map.of("greeting", "Bonjour"), ArbCodec.read(file));
    }
}
