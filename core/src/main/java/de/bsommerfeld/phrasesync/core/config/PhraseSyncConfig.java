package de.bsommerfeld.phrasesync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one nested POJO; every
 * field carries a default so a missing or partial file still yields a usable
 * configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PhraseSyncConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("translator")
    private TranslatorConfig translator = new TranslatorConfig();

    @JsonProperty("sync")
    private SyncConfig sync = new SyncConfig();

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public TranslatorConfig getTranslator() {
        return translator;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public StorageConfig getStorage() {
        return storage;
    }
}
