/**
 * Persistence for the source catalog and its translations. SQLite-backed in
 * production, in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [SyncOrchestrator / OverrideGuard / BundleImporter]
 *        │
 *        ▼
 *   PhraseStore        ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴────────┐
 *    │            │
 *  SqlPhraseStore InMemoryPhraseStore
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────┐
 * │ source_phrases                                                │
 * ├──────────────────┬────────────────────────────────────────────┤
 * │ phrase_key (PK)  │ stable identifier                          │
 * │ value            │ source-language text                       │
 * │ last_updated     │ ISO-8601 instant of the last change        │
 * └──────────────────┴────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────┐
 * │ translations                                                  │
 * ├──────────────────┬────────────────────────────────────────────┤
 * │ phrase_key (PK)  │ source phrase key                          │
 * │ locale     (PK)  │ target locale tag, e.g. "fr", "zh-Hans"    │
 * │ value            │ translated text                            │
 * │ translated_by    │ "azure" (automatic) or "manual"            │
 * │ last_updated     │ ISO-8601 instant of the last write         │
 * └──────────────────┴────────────────────────────────────────────┘
 * </pre>
 *
 * There is no foreign key between the tables: a translation may outlive its
 * source phrase, and source rows are written before any translation.
 *
 * <h2>SQL File Inventory</h2>
 * Statements live in {@code sql/*.sql}, loaded via {@link SqlLoader}:
 * <ul>
 * <li>{@code upsert-source-phrase.sql}</li>
 * <li>{@code select-all-source-phrases.sql}</li>
 * <li>{@code upsert-translation.sql}</li>
 * <li>{@code select-translation.sql}</li>
 * <li>{@code select-translations-for-locale.sql}</li>
 * <li>{@code select-locales.sql}</li>
 * </ul>
 */
package de.bsommerfeld.phrasesync.db;
