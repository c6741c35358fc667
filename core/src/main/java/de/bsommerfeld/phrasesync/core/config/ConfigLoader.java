package de.bsommerfeld.phrasesync.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link PhraseSyncConfig} from a TOML file.
 *
 * <p>
 * When the file does not exist yet, the defaults are written to it so the
 * operator has a template to edit. Unknown keys are ignored, missing keys
 * keep their defaults.
 *
 * <h3>API key resolution</h3>
 * The translator key is taken from the first non-blank source:
 * <ol>
 * <li>{@code translator.api-key} in the file</li>
 * <li>the {@value #API_KEY_ENV} environment variable</li>
 * <li>a {@code secret.txt} file next to the configuration file</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String API_KEY_ENV = "PHRASESYNC_API_KEY";
    static final String SECRET_FILE = "secret.txt";

    private final TomlMapper mapper;

    public ConfigLoader() {
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public PhraseSyncConfig load(Path configPath) {
        return load(configPath, System.getenv(API_KEY_ENV));
    }

    PhraseSyncConfig load(Path configPath, String envApiKey) {
        PhraseSyncConfig config;
        if (Files.exists(configPath)) {
            try {
                config = mapper.readValue(configPath.toFile(), PhraseSyncConfig.class);
            } catch (IOException e) {
                throw new ConfigException("Failed to read configuration " + configPath, e);
            }
        } else {
            config = new PhraseSyncConfig();
            writeDefaults(configPath, config);
        }

        resolveApiKey(config.getTranslator(), configPath, envApiKey);
        validate(config);
        return config;
    }

    private void writeDefaults(Path configPath, PhraseSyncConfig config) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(configPath.toFile(), config);
            LOG.info("Wrote default configuration to {}", configPath.toAbsolutePath());
        } catch (IOException e) {
            throw new ConfigException("Failed to write default configuration " + configPath, e);
        }
    }

    private void resolveApiKey(TranslatorConfig translator, Path configPath, String envApiKey) {
        if (!isBlank(translator.getApiKey())) {
            return;
        }
        if (!isBlank(envApiKey)) {
            translator.setApiKey(envApiKey.trim());
            return;
        }
        Path parent = configPath.toAbsolutePath().getParent();
        Path secret = parent == null ? Path.of(SECRET_FILE) : parent.resolve(SECRET_FILE);
        if (Files.exists(secret)) {
            try {
                translator.setApiKey(Files.readString(secret, StandardCharsets.UTF_8).trim());
            } catch (IOException e) {
                throw new ConfigException("Failed to read API key from " + secret, e);
            }
        }
    }

    private static void validate(PhraseSyncConfig config) {
        TranslatorConfig t = config.getTranslator();
        if (t.getBatchSize() < 1) {
            throw new ConfigException("translator.batch-size must be at least 1, got " + t.getBatchSize());
        }
        if (t.getMaxRetries() < 1) {
            throw new ConfigException("translator.max-retries must be at least 1, got " + t.getMaxRetries());
        }
        if (t.getBackoffBaseSeconds() < 0 || t.getBatchPauseSeconds() < 0) {
            throw new ConfigException("translator delays must not be negative");
        }
        if (isBlank(config.getSync().getSourceLocale())) {
            throw new ConfigException("sync.source-locale must be set");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
