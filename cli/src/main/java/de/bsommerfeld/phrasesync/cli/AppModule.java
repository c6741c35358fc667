package de.bsommerfeld.phrasesync.cli;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.config.ApplicationMode;
import de.bsommerfeld.phrasesync.core.config.ConfigException;
import de.bsommerfeld.phrasesync.core.config.ConfigLoader;
import de.bsommerfeld.phrasesync.core.config.PhraseSyncConfig;
import de.bsommerfeld.phrasesync.core.config.StorageConfig;
import de.bsommerfeld.phrasesync.core.config.SyncConfig;
import de.bsommerfeld.phrasesync.core.config.TranslatorConfig;
import de.bsommerfeld.phrasesync.core.util.StorageUtils;
import de.bsommerfeld.phrasesync.db.InMemoryPhraseStore;
import de.bsommerfeld.phrasesync.db.PhraseStore;
import de.bsommerfeld.phrasesync.db.SqlPhraseStore;
import de.bsommerfeld.phrasesync.translator.AzureTranslator;
import de.bsommerfeld.phrasesync.translator.EchoTranslator;
import de.bsommerfeld.phrasesync.translator.Sleeper;
import de.bsommerfeld.phrasesync.translator.TranslationOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice module wiring configuration, storage and the translation oracle.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final PhraseSyncConfig config;
    private final ApplicationMode mode;

    public AppModule(PhraseSyncConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    /**
     * Loads {@code config.toml} from the application data directory, creating
     * it with defaults on first start.
     */
    public static AppModule fromAppData() {
        Path appDataDir = StorageUtils.getAppDataDir();
        try {
            Files.createDirectories(appDataDir);
        } catch (IOException e) {
            throw new ConfigException("Cannot create application directory " + appDataDir, e);
        }
        Path configPath = appDataDir.resolve("config.toml");
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        return new AppModule(new ConfigLoader().load(configPath), ApplicationMode.get());
    }

    public PhraseSyncConfig getConfig() {
        return config;
    }

    @Override
    protected void configure() {
        bind(PhraseSyncConfig.class).toInstance(config);
        bind(TranslatorConfig.class).toInstance(config.getTranslator());
        bind(SyncConfig.class).toInstance(config.getSync());
        bind(StorageConfig.class).toInstance(config.getStorage());

        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
        bind(Clock.class).toInstance(Clock.systemUTC());

        LOG.info("Application mode: {}", mode);
        if (mode.isPersistent()) {
            bind(PhraseStore.class).to(SqlPhraseStore.class).in(Singleton.class);
            bind(TranslationOracle.class).to(AzureTranslator.class).in(Singleton.class);
        } else {
            bind(PhraseStore.class).to(InMemoryPhraseStore.class).in(Singleton.class);
            bind(TranslationOracle.class).to(EchoTranslator.class).in(Singleton.class);
        }
    }
}
