package de.bsommerfeld.phrasesync.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects the store and translator implementations wired at startup.
 */
public enum ApplicationMode {

    /** SQLite store under the app-data directory, Azure translator. */
    PROD(true),
    /** In-memory store, echo translator. Nothing is written, nothing is sent. */
    TEST(false);

    static final String PROPERTY = "app.mode";
    static final String ENV = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    private final boolean persistent;

    ApplicationMode(boolean persistent) {
        this.persistent = persistent;
    }

    /**
     * Reads the {@code app.mode} system property, then the {@code APP_MODE}
     * environment variable. Unset or unknown values mean {@link #PROD}.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENV));
    }

    static ApplicationMode resolve(String property, String env) {
        return parse(property != null && !property.isBlank() ? property : env);
    }

    static ApplicationMode parse(String value) {
        if (value == null || value.isBlank()) {
            return PROD;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ApplicationMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        LOG.warn("Unknown application mode '{}', using {}", value, PROD);
        return PROD;
    }

    /** Whether phrases and translations survive the process. */
    public boolean isPersistent() {
        return persistent;
    }
}
