package de.bsommerfeld.phrasesync.cli;

import ch.qos.logback.classic.Level;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.phrasesync.core.config.ConfigException;
import de.bsommerfeld.phrasesync.core.util.StorageUtils;
import de.bsommerfeld.phrasesync.db.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Command line entry point.
 *
 * <p>
 * Startup: parse arguments, load {@code config.toml}, build the injector,
 * run the command. Configuration and storage problems end the process with
 * {@link PhraseSyncCli#EXIT_FAILURE}; per-key problems with
 * {@link PhraseSyncCli#EXIT_INCOMPLETE}.
 */
public final class PhraseSyncMain {

    static final String LOG_DIR_PROPERTY = "phrasesync.logs";

    static {
        // Read by logback.xml, so it must be set before the first logger exists
        if (System.getProperty(LOG_DIR_PROPERTY) == null) {
            System.setProperty(LOG_DIR_PROPERTY, StorageUtils.getLogsDir().toString());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PhraseSyncMain.class);

    private PhraseSyncMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CommandLine line;
        try {
            line = CommandLine.parse(args);
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            System.err.print(CommandLine.usage());
            return PhraseSyncCli.EXIT_USAGE;
        }
        if (line.command().equals(CommandLine.HELP)) {
            System.out.print(CommandLine.usage());
            return PhraseSyncCli.EXIT_OK;
        }

        try {
            AppModule module = AppModule.fromAppData();
            if (module.getConfig().isDebugMode()) {
                enableDebugLogging();
            }
            Injector injector = Guice.createInjector(module);
            return injector.getInstance(PhraseSyncCli.class).execute(line);
        } catch (ConfigException e) {
            LOG.error("Configuration error: {}", e.getMessage(), e);
        } catch (StorageException e) {
            LOG.error("Storage error: {}", e.getMessage(), e);
        } catch (IOException e) {
            LOG.error("I/O error: {}", e.getMessage(), e);
        }
        return PhraseSyncCli.EXIT_FAILURE;
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
            LOG.debug("Debug logging enabled");
        }
    }
}
