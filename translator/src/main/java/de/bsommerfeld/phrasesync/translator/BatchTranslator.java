package de.bsommerfeld.phrasesync.translator;

import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.config.TranslatorConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a {@link TranslationOracle} over a list of phrases in fixed-size
 * chunks.
 *
 * <h3>Per-chunk outcome</h3>
 * <ul>
 * <li><strong>Success</strong> with as many results as inputs: keys are zipped
 * to results in order and handed to the {@link ChunkListener}.</li>
 * <li><strong>Shape mismatch</strong> (wrong result count): the whole chunk
 * fails.</li>
 * <li><strong>Rate limited</strong>: the same chunk is sent again, at most
 * {@code maxRetries} invocations in total. Waits start at the base delay and
 * double after every throttled attempt (10s, 20s, 40s, ...). Exhaustion fails
 * the chunk.</li>
 * <li><strong>Any other oracle error</strong>: the chunk fails without
 * retry.</li>
 * </ul>
 * A failed chunk never aborts the remaining chunks. After every successful
 * chunk that is not the last one a fixed pause is observed to respect
 * upstream throughput limits.
 *
 * <h3>What propagates</h3>
 * Only exceptions thrown by the {@link ChunkListener} (typically a storage
 * failure while persisting the chunk). Oracle failures are always converted
 * into failed keys.
 *
 * <h3>Interruption</h3>
 * If the thread is interrupted while waiting, the current and all remaining
 * chunks are reported as failed and the interrupt flag is restored.
 */
@Singleton
public class BatchTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchTranslator.class);

    /**
     * Receives each successfully translated chunk before the next chunk is
     * sent, so progress can be persisted incrementally.
     */
    @FunctionalInterface
    public interface ChunkListener {

        ChunkListener NONE = chunk -> {
        };

        void onChunkTranslated(Map<String, String> chunk);
    }

    private final TranslationOracle oracle;
    private final Sleeper sleeper;
    private final TranslatorConfig config;

    @Inject
    public BatchTranslator(TranslationOracle oracle, Sleeper sleeper, TranslatorConfig config) {
        this.oracle = oracle;
        this.sleeper = sleeper;
        this.config = config;
    }

    public BatchResult translateBatches(String fromLocale, String toLocale,
            List<Map.Entry<String, String>> entries) {
        return translateBatches(fromLocale, toLocale, entries, config.getBatchSize(), ChunkListener.NONE);
    }

    public BatchResult translateBatches(String fromLocale, String toLocale,
            List<Map.Entry<String, String>> entries, ChunkListener listener) {
        return translateBatches(fromLocale, toLocale, entries, config.getBatchSize(), listener);
    }

    public BatchResult translateBatches(String fromLocale, String toLocale,
            List<Map.Entry<String, String>> entries, int batchSize) {
        return translateBatches(fromLocale, toLocale, entries, batchSize, ChunkListener.NONE);
    }

    public BatchResult translateBatches(String fromLocale, String toLocale,
            List<Map.Entry<String, String>> entries, int batchSize, ChunkListener listener) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
        if (entries.isEmpty()) {
            return BatchResult.empty();
        }

        Map<String, String> merged = new LinkedHashMap<>();
        List<String> failedKeys = new ArrayList<>();
        CallCounter calls = new CallCounter();
        int totalChunks = (entries.size() + batchSize - 1) / batchSize;

        for (int start = 0; start < entries.size(); start += batchSize) {
            int end = Math.min(start + batchSize, entries.size());
            List<Map.Entry<String, String>> chunk = entries.subList(start, end);
            int chunkNumber = start / batchSize + 1;
            boolean last = end == entries.size();

            LOG.info("[{}] Translating batch {}/{} ({} phrases)", toLocale, chunkNumber, totalChunks, chunk.size());

            Map<String, String> translated;
            try {
                translated = translateChunk(fromLocale, toLocale, chunk, chunkNumber, calls);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("[{}] Interrupted during batch {}; remaining phrases marked as failed", toLocale,
                        chunkNumber);
                addKeys(failedKeys, entries.subList(start, entries.size()));
                break;
            }

            if (translated == null) {
                addKeys(failedKeys, chunk);
                continue;
            }

            listener.onChunkTranslated(translated);
            merged.putAll(translated);

            if (!last) {
                try {
                    pause(config.batchPause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("[{}] Interrupted between batches; remaining phrases marked as failed", toLocale);
                    addKeys(failedKeys, entries.subList(end, entries.size()));
                    break;
                }
            }
        }

        if (!failedKeys.isEmpty()) {
            LOG.warn("[{}] {} of {} phrases failed to translate", toLocale, failedKeys.size(), entries.size());
        }
        return new BatchResult(merged, failedKeys, calls.count);
    }

    /**
     * Sends one chunk, retrying on rate limits.
     *
     * @return the translations keyed by phrase key, or {@code null} if the
     *         chunk failed
     */
    private Map<String, String> translateChunk(String fromLocale, String toLocale,
            List<Map.Entry<String, String>> chunk, int chunkNumber, CallCounter calls) throws InterruptedException {
        List<String> texts = new ArrayList<>(chunk.size());
        for (Map.Entry<String, String> e : chunk) {
            texts.add(e.getValue());
        }

        int maxRetries = config.getMaxRetries();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            List<String> results;
            try {
                calls.count++;
                results = oracle.translate(fromLocale, toLocale, texts);
            } catch (RateLimitedException e) {
                if (attempt >= maxRetries) {
                    LOG.error("[{}] Rate limit exceeded on batch {} after {} attempts", toLocale, chunkNumber,
                            maxRetries);
                    return null;
                }
                Duration wait = backoffDelay(attempt);
                LOG.warn("[{}] Rate limited. Waiting {}s before retry {}/{}...", toLocale, wait.toSeconds(),
                        attempt, maxRetries - 1);
                pause(wait);
                continue;
            } catch (OracleException | RuntimeException e) {
                LOG.error("[{}] Error on batch {}: {}", toLocale, chunkNumber, e.getMessage(), e);
                return null;
            }

            if (results == null || results.size() != texts.size()) {
                LOG.error("[{}] Batch {} returned {} translations for {} phrases", toLocale, chunkNumber,
                        results == null ? 0 : results.size(), texts.size());
                return null;
            }

            Map<String, String> translated = new LinkedHashMap<>();
            for (int i = 0; i < chunk.size(); i++) {
                translated.put(chunk.get(i).getKey(), results.get(i));
            }
            return translated;
        }
        return null;
    }

    private static void addKeys(List<String> target, List<Map.Entry<String, String>> entries) {
        for (Map.Entry<String, String> entry : entries) {
            target.add(entry.getKey());
        }
    }

    /** Oracle requests issued during one {@link #translateBatches} call, retries included. */
    private static final class CallCounter {
        int count;
    }

    /** Base delay doubled per throttled attempt: base, 2*base, 4*base, ... */
    Duration backoffDelay(int attempt) {
        return config.backoffBase().multipliedBy(1L << (attempt - 1));
    }

    private void pause(Duration duration) throws InterruptedException {
        if (!duration.isZero()) {
            sleeper.sleep(duration);
        }
    }
}
