package de.bsommerfeld.phrasesync.translator;

import de.bsommerfeld.phrasesync.core.config.TranslatorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests BatchTranslator's chunking, retry and failure classification. The
 * oracle is mocked or stubbed; the sleeper only records requested delays.
 */
@ExtendWith(MockitoExtension.class)
class BatchTranslatorTest {

    @Mock
    private TranslationOracle oracle;

    private final List<Duration> sleeps = new ArrayList<>();
    private TranslatorConfig config;

    @BeforeEach
    void setUp() {
        config = new TranslatorConfig();
    }

    // -- Chunking --

    @Test
    void translateBatches_shouldZipResultsToKeysInOrder() throws Exception {
        when(oracle.translate("en", "fr", List.of("Hello", "Bye")))
                .thenReturn(List.of("Bonjour", "Au revoir"));

        BatchResult result = translator(oracle).translateBatches("en", "fr",
                entries("greeting", "Hello", "farewell", "Bye"));

        assertEquals(Map.of("greeting", "Bonjour", "farewell", "Au revoir"), result.merged());
        assertEquals(List.of("greeting", "farewell"), List.copyOf(result.merged().keySet()));
        assertFalse(result.hasFailures());
        assertEquals(1, result.oracleCalls());
    }

    @Test
    void translateBatches_shouldSplitIntoChunksOfBatchSize() throws Exception {
        List<Integer> chunkSizes = new ArrayList<>();
        TranslationOracle stub = (from, to, texts) -> {
            chunkSizes.add(texts.size());
            return prefixed(to, texts);
        };

        BatchResult result = translator(stub).translateBatches("en", "fr", numbered(250), 100);

        assertEquals(List.of(100, 100, 50), chunkSizes);
        assertEquals(250, result.merged().size());
    }

    @Test
    void translateBatches_shouldPauseBetweenChunksButNotAfterLast() {
        TranslationOracle stub = (from, to, texts) -> prefixed(to, texts);

        translator(stub).translateBatches("en", "fr", numbered(250), 100);

        assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(3)), sleeps);
    }

    @Test
    void translateBatches_shouldNotCallOracleForEmptyInput() {
        BatchResult result = translator(oracle).translateBatches("en", "fr", List.of());

        assertTrue(result.merged().isEmpty());
        assertEquals(0, result.oracleCalls());
        verifyNoInteractions(oracle);
    }

    @Test
    void translateBatches_shouldRejectNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class,
                () -> translator(oracle).translateBatches("en", "fr", numbered(3), 0));
    }

    @Test
    void translateBatches_shouldProduceSameOutputForAnyBatchSize() {
        TranslationOracle stub = (from, to, texts) -> prefixed(to, texts);
        List<Map.Entry<String, String>> input = numbered(250);

        BatchResult by100 = translator(stub).translateBatches("en", "fr", input, 100);
        BatchResult by37 = translator(stub).translateBatches("en", "fr", input, 37);

        assertEquals(by100.merged(), by37.merged());
        assertEquals(List.copyOf(by100.merged().keySet()), List.copyOf(by37.merged().keySet()));
    }

    @Test
    void translateBatches_forcedFailureShouldOnlyAffectItsChunk() {
        TranslationOracle stub = (from, to, texts) -> {
            if (texts.contains("text-150")) {
                throw new OracleException("boom");
            }
            return prefixed(to, texts);
        };
        List<Map.Entry<String, String>> input = numbered(250);

        BatchResult by100 = translator(stub).translateBatches("en", "fr", input, 100);
        BatchResult by37 = translator(stub).translateBatches("en", "fr", input, 37);

        assertEquals(100, by100.failedKeys().size());
        assertEquals("key-100", by100.failedKeys().get(0));
        assertEquals("key-199", by100.failedKeys().get(99));
        assertEquals(37, by37.failedKeys().size());
        assertEquals("key-148", by37.failedKeys().get(0));

        // outside the failed chunks, both runs agree
        by100.merged().forEach((k, v) -> {
            if (!by37.failedKeys().contains(k)) {
                assertEquals(v, by37.merged().get(k));
            }
        });
        assertEquals(250, by100.merged().size() + by100.failedKeys().size());
        assertEquals(250, by37.merged().size() + by37.failedKeys().size());
    }

    // -- Rate Limiting --

    @Test
    void translateBatches_shouldStopAfterMaxRetriesWhenAlwaysRateLimited() throws Exception {
        when(oracle.translate(any(), any(), anyList()))
                .thenThrow(new RateLimitedException("429", "{}"));

        BatchResult result = translator(oracle).translateBatches("en", "fr", entries("a", "A", "b", "B"));

        verify(oracle, times(3)).translate(eq("en"), eq("fr"), anyList());
        assertEquals(List.of(Duration.ofSeconds(10), Duration.ofSeconds(20)), sleeps);
        assertEquals(List.of("a", "b"), result.failedKeys());
        assertTrue(result.merged().isEmpty());
        assertEquals(3, result.oracleCalls());
    }

    @Test
    void translateBatches_shouldDoubleBackoffForEveryThrottledAttempt() throws Exception {
        config.setMaxRetries(4);
        when(oracle.translate(any(), any(), anyList()))
                .thenThrow(new RateLimitedException("429", "{}"));

        translator(oracle).translateBatches("en", "fr", entries("a", "A"));

        verify(oracle, times(4)).translate(any(), any(), anyList());
        assertEquals(List.of(Duration.ofSeconds(10), Duration.ofSeconds(20), Duration.ofSeconds(40)), sleeps);
    }

    @Test
    void translateBatches_shouldRecoverWhenRetrySucceeds() throws Exception {
        when(oracle.translate(any(), any(), anyList()))
                .thenThrow(new RateLimitedException("429", "{}"))
                .thenReturn(List.of("Bonjour"));

        BatchResult result = translator(oracle).translateBatches("en", "fr", entries("greeting", "Hello"));

        assertEquals(Map.of("greeting", "Bonjour"), result.merged());
        assertEquals(List.of(Duration.ofSeconds(10)), sleeps);
        assertEquals(2, result.oracleCalls());
    }

    @Test
    void translateBatches_exhaustedChunkShouldNotAbortFollowingChunks() throws Exception {
        when(oracle.translate(any(), any(), eq(List.of("A", "B"))))
                .thenThrow(new RateLimitedException("429", "{}"));
        when(oracle.translate(any(), any(), eq(List.of("C"))))
                .thenReturn(List.of("c"));

        BatchResult result = translator(oracle).translateBatches("en", "fr",
                entries("a", "A", "b", "B", "c", "C"), 2);

        assertEquals(List.of("a", "b"), result.failedKeys());
        assertEquals(Map.of("c", "c"), result.merged());
    }

    // -- Other Failures --

    @Test
    void translateBatches_shouldFailChunkOnShapeMismatchWithoutRetry() throws Exception {
        when(oracle.translate(any(), any(), anyList())).thenReturn(List.of("only one"));

        BatchResult result = translator(oracle).translateBatches("en", "fr", entries("a", "A", "b", "B"));

        verify(oracle, times(1)).translate(any(), any(), anyList());
        assertEquals(List.of("a", "b"), result.failedKeys());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void translateBatches_shouldFailChunkOnOracleErrorWithoutRetry() throws Exception {
        when(oracle.translate(any(), any(), anyList())).thenThrow(new OracleException("400036"));

        BatchResult result = translator(oracle).translateBatches("en", "xx", entries("a", "A"));

        verify(oracle, times(1)).translate(any(), any(), anyList());
        assertEquals(List.of("a"), result.failedKeys());
    }

    @Test
    void translateBatches_shouldTreatRuntimeExceptionAsChunkFailure() throws Exception {
        when(oracle.translate(any(), any(), anyList())).thenThrow(new IllegalStateException("parse"));

        BatchResult result = translator(oracle).translateBatches("en", "fr", entries("a", "A"));

        assertEquals(List.of("a"), result.failedKeys());
    }

    @Test
    void translateBatches_shouldTreatNullResultAsChunkFailure() throws Exception {
        when(oracle.translate(any(), any(), anyList())).thenReturn(null);

        BatchResult result = translator(oracle).translateBatches("en", "fr", entries("a", "A"));

        assertEquals(List.of("a"), result.failedKeys());
    }

    // -- Listener --

    @Test
    void translateBatches_shouldNotifyListenerPerSuccessfulChunk() {
        TranslationOracle stub = (from, to, texts) -> {
            if (texts.contains("text-2")) {
                throw new OracleException("boom");
            }
            return prefixed(to, texts);
        };
        List<Map<String, String>> chunks = new ArrayList<>();

        translator(stub).translateBatches("en", "fr", numbered(5), 2, chunks::add);

        assertEquals(2, chunks.size());
        assertEquals(List.of("key-0", "key-1"), List.copyOf(chunks.get(0).keySet()));
        assertEquals(List.of("key-4"), List.copyOf(chunks.get(1).keySet()));
    }

    @Test
    void translateBatches_shouldPropagateListenerFailures() {
        TranslationOracle stub = (from, to, texts) -> prefixed(to, texts);

        assertThrows(IllegalStateException.class, () -> translator(stub).translateBatches("en", "fr",
                numbered(3), 2, chunk -> {
                    throw new IllegalStateException("disk full");
                }));
    }

    @Test
    void translateBatches_shouldFailRemainingChunksWhenInterrupted() {
        TranslationOracle stub = (from, to, texts) -> prefixed(to, texts);
        Sleeper interrupting = duration -> {
            throw new InterruptedException();
        };
        BatchTranslator translator = new BatchTranslator(stub, interrupting, config);

        BatchResult result = translator.translateBatches("en", "fr", numbered(5), 2);

        assertTrue(Thread.interrupted());
        assertEquals(List.of("key-0", "key-1"), List.copyOf(result.merged().keySet()));
        assertEquals(List.of("key-2", "key-3", "key-4"), result.failedKeys());
    }

    @Test
    void backoffDelay_shouldDoubleFromBase() {
        BatchTranslator translator = translator(oracle);

        assertEquals(Duration.ofSeconds(10), translator.backoffDelay(1));
        assertEquals(Duration.ofSeconds(20), translator.backoffDelay(2));
        assertEquals(Duration.ofSeconds(40), translator.backoffDelay(3));
    }

    // -- Helpers --

    private BatchTranslator translator(TranslationOracle o) {
        return new BatchTranslator(o, sleeps::add, config);
    }

    private static List<String> prefixed(String locale, List<String> texts) {
        List<String> out = new ArrayList<>();
        for (String t : texts) {
            out.add(locale + ":" + t);
        }
        return out;
    }

    private static List<Map.Entry<String, String>> numbered(int count) {
        List<Map.Entry<String, String>> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            list.add(new AbstractMap.SimpleImmutableEntry<>("key-" + i, "text-" + i));
        }
        return list;
    }

    private static List<Map.Entry<String, String>> entries(String... kv) {
        List<Map.Entry<String, String>> list = new ArrayList<>();
        for (int i = 0; i < kv.length; i += 2) {
            list.add(new AbstractMap.SimpleImmutableEntry<>(kv[i], kv[i + 1]));
        }
        return list;
    }
}
