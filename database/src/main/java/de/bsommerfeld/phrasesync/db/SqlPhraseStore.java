package de.bsommerfeld.phrasesync.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.config.StorageConfig;
import de.bsommerfeld.phrasesync.core.domain.Provenance;
import de.bsommerfeld.phrasesync.core.domain.SourcePhrase;
import de.bsommerfeld.phrasesync.core.domain.Translation;
import de.bsommerfeld.phrasesync.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite-backed {@link PhraseStore} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level anyway and the sync engine
 * is the only writer, so pooling provides no benefit.
 *
 * <h3>Transaction boundaries</h3>
 * Multi-record writes run in explicit transactions with rollback-on-failure:
 * one for a batch of source phrases, one per locale for a batch of
 * translations. Single-row reads use auto-commit.
 *
 * <h3>Timestamps</h3>
 * Stored as ISO-8601 text. Databases written by earlier tooling contain local
 * date-times without an offset; those are read in the system time zone.
 */
@Singleton
public class SqlPhraseStore implements PhraseStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlPhraseStore.class);
    private final String dbUrl;

    @Inject
    public SqlPhraseStore(StorageConfig config) {
        this(StorageUtils.resolveInAppData(config.getDatabaseFile()));
    }

    public SqlPhraseStore(Path dbFile) {
        Path parent = dbFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory " + parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + dbFile.toAbsolutePath();
        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing phrase database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StorageException("Database initialization failed", e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql}, one statement at a time,
     * inside a single transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        List<String> statements;
        try {
            statements = SqlLoader.script("schema.sql");
        } catch (IllegalStateException e) {
            throw new SQLException("schema.sql not available", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            conn.commit();
            LOG.debug("Database schema applied ({} statements).", statements.size());
        } catch (SQLException e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    // =====================================================================
    // Source Phrases
    // =====================================================================

    @Override
    public Map<String, SourcePhrase> getAllSourcePhrases() {
        Map<String, SourcePhrase> result = new LinkedHashMap<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-source-phrases"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String key = rs.getString("phrase_key");
                result.put(key, new SourcePhrase(key, rs.getString("value"),
                        parseInstant(rs.getString("last_updated"))));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load source phrases", e);
        }
        return result;
    }

    @Override
    public void saveSourcePhrases(List<SourcePhrase> phrases) {
        if (phrases == null || phrases.isEmpty())
            return;

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-source-phrase"))) {
                for (SourcePhrase p : phrases) {
                    ps.setString(1, p.key());
                    ps.setString(2, p.value());
                    ps.setString(3, p.lastUpdated().toString());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to save " + phrases.size() + " source phrases", e);
        }
        LOG.debug("[DB] Saved {} source phrases.", phrases.size());
    }

    // =====================================================================
    // Translations
    // =====================================================================

    @Override
    public Optional<Translation> getTranslation(String phraseKey, String locale) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-translation"))) {
            ps.setString(1, phraseKey);
            ps.setString(2, locale);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTranslation(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load translation " + phraseKey + "/" + locale, e);
        }
    }

    @Override
    public void saveTranslation(Translation translation) {
        saveTranslations(Collections.singletonList(translation));
    }

    @Override
    public void saveTranslations(List<Translation> translations) {
        if (translations == null || translations.isEmpty())
            return;

        Map<String, List<Translation>> byLocale = new LinkedHashMap<>();
        for (Translation t : translations) {
            byLocale.computeIfAbsent(t.locale(), k -> new ArrayList<>()).add(t);
        }

        for (Map.Entry<String, List<Translation>> entry : byLocale.entrySet()) {
            saveLocaleTranslations(entry.getKey(), entry.getValue());
        }
    }

    /** Commits one locale's translations as a single transaction. */
    private void saveLocaleTranslations(String locale, List<Translation> translations) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-translation"))) {
                for (Translation t : translations) {
                    ps.setString(1, t.phraseKey());
                    ps.setString(2, t.locale());
                    ps.setString(3, t.value());
                    ps.setString(4, t.provenance().storageValue());
                    ps.setString(5, t.lastUpdated().toString());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to save " + translations.size()
                    + " translations for locale " + locale, e);
        }
        LOG.debug("[DB] Saved {} translations for {}.", translations.size(), locale);
    }

    @Override
    public Map<String, Translation> getTranslationsForLocale(String locale) {
        Map<String, Translation> result = new LinkedHashMap<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-translations-for-locale"))) {
            ps.setString(1, locale);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Translation t = mapTranslation(rs);
                    result.put(t.phraseKey(), t);
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load translations for locale " + locale, e);
        }
        return result;
    }

    @Override
    public Set<String> getLocales() {
        Set<String> locales = new LinkedHashSet<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-locales"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                locales.add(rs.getString("locale"));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list locales", e);
        }
        return locales;
    }

    // =====================================================================
    // Mapping
    // =====================================================================

    private Translation mapTranslation(ResultSet rs) throws SQLException {
        String key = rs.getString("phrase_key");
        String storedProvenance = rs.getString("translated_by");
        Provenance provenance;
        try {
            provenance = Provenance.fromStorageValue(storedProvenance);
        } catch (IllegalArgumentException e) {
            throw new StorageException("Corrupt provenance '" + storedProvenance + "' for " + key, e);
        }
        return new Translation(key, rs.getString("locale"), rs.getString("value"),
                provenance, parseInstant(rs.getString("last_updated")));
    }

    /**
     * @throws StorageException if the value is neither an ISO-8601 instant nor
     *                          a legacy local date-time
     */
    static Instant parseInstant(String text) {
        if (text == null) {
            throw new StorageException("Missing timestamp");
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant();
            } catch (DateTimeParseException legacy) {
                throw new StorageException("Corrupt timestamp '" + text + "'", legacy);
            }
        }
    }
}
